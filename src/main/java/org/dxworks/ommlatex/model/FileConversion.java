package org.dxworks.ommlatex.model;

import java.util.ArrayList;
import java.util.List;

public class FileConversion {
    public String filePath;
    public List<ExpressionConversion> expressions = new ArrayList<>();
}
