package org.dxworks.ommlatex.model;

import java.util.HashMap;
import java.util.Map;

/**
 * Structural role of a {@link MathNode}, keyed by the OMML element name it is read from.
 */
public enum MathNodeKind {
    ROOT("oMath"),
    PARAGRAPH("oMathPara"),
    RUN("r"),
    FRACTION("f"),
    SUPERSCRIPT("sSup"),
    SUBSCRIPT("sSub"),
    SUB_SUPERSCRIPT("sSubSup"),
    NARY("nary"),
    RADICAL("rad"),
    DELIMITER("d"),
    MATRIX("m"),
    MATRIX_ROW("mr"),
    FUNCTION("func"),
    LIMIT_LOWER("limLow"),
    LIMIT_UPPER("limUpp"),
    ACCENT("acc"),
    EQUATION_ARRAY("eqArr"),
    ARGUMENT(null),
    UNKNOWN(null);

    private static final Map<String, MathNodeKind> BY_TAG = new HashMap<>();

    static {
        for (MathNodeKind kind : values()) {
            if (kind.tag != null) {
                BY_TAG.put(kind.tag, kind);
            }
        }
    }

    private final String tag;

    MathNodeKind(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    /**
     * Kind for an OMML element name. Role containers (e, num, den, ...) map to {@link #ARGUMENT},
     * anything else not listed here to {@link #UNKNOWN}.
     */
    public static MathNodeKind fromTag(String tag) {
        if (tag == null) return UNKNOWN;
        MathNodeKind kind = BY_TAG.get(tag);
        if (kind != null) return kind;
        return MathRole.fromTag(tag) != null ? ARGUMENT : UNKNOWN;
    }
}
