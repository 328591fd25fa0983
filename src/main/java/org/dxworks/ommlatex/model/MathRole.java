package org.dxworks.ommlatex.model;

/**
 * Named role a child plays inside its parent (numerator, base, degree, ...).
 */
public enum MathRole {
    NUMERATOR("num"),
    DENOMINATOR("den"),
    BASE("e"),
    SUPERSCRIPT("sup"),
    SUBSCRIPT("sub"),
    DEGREE("deg"),
    FUNCTION_NAME("fName"),
    LIMIT("lim");

    private final String tag;

    MathRole(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    public static MathRole fromTag(String tag) {
        for (MathRole role : values()) {
            if (role.tag.equals(tag)) {
                return role;
            }
        }
        return null;
    }
}
