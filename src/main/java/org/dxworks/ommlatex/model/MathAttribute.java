package org.dxworks.ommlatex.model;

/**
 * Properties read from the {@code *Pr} element of a node.
 */
public enum MathAttribute {
    OPERATOR_CHAR,
    BEGIN_CHAR,
    END_CHAR,
    SEPARATOR_CHAR,
    ACCENT_CHAR,
    DEGREE_HIDDEN,
    SUB_HIDDEN,
    SUP_HIDDEN
}
