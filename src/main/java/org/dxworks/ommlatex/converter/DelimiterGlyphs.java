package org.dxworks.ommlatex.converter;

import java.util.HashMap;
import java.util.Map;

/**
 * Delimiter glyphs: their scalable {@code \left}/{@code \right} forms and the matrix
 * environment each opening glyph selects.
 */
public final class DelimiterGlyphs {

    public static final String DEFAULT_OPEN = "(";
    public static final String DEFAULT_CLOSE = ")";
    public static final String DEFAULT_SEPARATOR = "|";

    public static final String PLAIN_MATRIX = "matrix";

    private static final Map<String, String> SCALABLE = new HashMap<>();
    private static final Map<String, String> MATRIX_ENVIRONMENTS = new HashMap<>();

    static {
        SCALABLE.put("", ".");
        SCALABLE.put("(", "(");
        SCALABLE.put(")", ")");
        SCALABLE.put("[", "[");
        SCALABLE.put("]", "]");
        SCALABLE.put("{", "\\{");
        SCALABLE.put("}", "\\}");
        SCALABLE.put("|", "|");
        SCALABLE.put("‖", "\\|");
        SCALABLE.put("⟨", "\\langle");
        SCALABLE.put("⟩", "\\rangle");
        SCALABLE.put("〈", "\\langle");
        SCALABLE.put("〉", "\\rangle");
        SCALABLE.put("⌊", "\\lfloor");
        SCALABLE.put("⌋", "\\rfloor");
        SCALABLE.put("⌈", "\\lceil");
        SCALABLE.put("⌉", "\\rceil");

        MATRIX_ENVIRONMENTS.put("(", "pmatrix");
        MATRIX_ENVIRONMENTS.put("[", "bmatrix");
        MATRIX_ENVIRONMENTS.put("{", "Bmatrix");
        MATRIX_ENVIRONMENTS.put("|", "vmatrix");
        MATRIX_ENVIRONMENTS.put("‖", "Vmatrix");
        MATRIX_ENVIRONMENTS.put("", PLAIN_MATRIX);
    }

    private DelimiterGlyphs() {}

    /** Scalable form of a glyph, {@code "."} for an empty side, or null when there is none. */
    public static String scalable(String glyph) {
        return SCALABLE.get(glyph != null ? glyph : "");
    }

    /**
     * Matrix environment selected by the opening glyph. Glyphs without a dedicated environment
     * get the parenthesized one.
     */
    public static String matrixEnvironment(String openGlyph) {
        String environment = MATRIX_ENVIRONMENTS.get(openGlyph != null ? openGlyph : DEFAULT_OPEN);
        return environment != null ? environment : "pmatrix";
    }

    /**
     * Wraps content in scalable delimiters, falling back to the literal glyphs when either side
     * has no scalable form. Literal braces are escaped so they never open or close a group.
     */
    public static String wrap(String open, String close, String content) {
        String left = scalable(open);
        String right = scalable(close);
        if (left == null || right == null) {
            return literal(open) + content + literal(close);
        }
        StringBuilder sb = new StringBuilder("\\left").append(left);
        if (LatexHelper.endsWithCommand(sb) && !content.isEmpty() && Character.isLetter(content.charAt(0))) {
            sb.append(' ');
        }
        return sb.append(content).append("\\right").append(right).toString();
    }

    private static String literal(String glyph) {
        if (glyph == null) return "";
        return glyph.replace("{", "\\{").replace("}", "\\}");
    }
}
