package org.dxworks.ommlatex.converter;

import org.dxworks.ommlatex.model.MathNode;

public interface MathConverter {
    String convert(MathNode expression);
}
