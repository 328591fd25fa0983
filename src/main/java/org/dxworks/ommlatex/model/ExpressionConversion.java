package org.dxworks.ommlatex.model;

import com.fasterxml.jackson.annotation.JsonInclude;

public class ExpressionConversion {
    public int index; // 1-based position of the oMath element in its file
    public String text; // concatenated run text, also used as placeholder output
    public String latex;
    @JsonInclude(JsonInclude.Include.NON_DEFAULT)
    public boolean fallback; // latex is the plain-text placeholder, conversion failed
}
