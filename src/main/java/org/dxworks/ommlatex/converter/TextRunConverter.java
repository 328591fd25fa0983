package org.dxworks.ommlatex.converter;

import java.util.regex.Pattern;

/**
 * Converts the literal text of a run.
 *
 * <p>Differential patterns are rewritten on the raw text, before symbol substitution, so the
 * inserted {@code \,} spacing is not touched again by later steps.</p>
 */
public final class TextRunConverter {

    private static final String DIFFERENTIAL = "\u2146"; // double-struck italic d

    private static final Pattern DOUBLE_DIFFERENTIAL_GLYPH =
            Pattern.compile("([a-z])" + DIFFERENTIAL + "([a-z])" + DIFFERENTIAL);
    private static final Pattern SINGLE_DIFFERENTIAL_GLYPH =
            Pattern.compile("([a-z])" + DIFFERENTIAL);
    private static final Pattern DOUBLE_DIFFERENTIAL_LETTER =
            Pattern.compile("([a-z])d([a-z])d\\b");
    private static final Pattern GREEK_DIFFERENTIAL_LETTER =
            Pattern.compile("([a-z])d([α-ω])");

    private static final String THIN_SPACE_D = " \\\\, d";

    private TextRunConverter() {}

    public static String convert(String text) {
        if (text == null || text.isEmpty()) return "";

        String result = text.replace('−', '-');
        result = rewriteDifferentials(result);
        result = SymbolTable.substitute(result);
        return FunctionNames.substitute(result);
    }

    static String rewriteDifferentials(String text) {
        String result = DOUBLE_DIFFERENTIAL_GLYPH.matcher(text).replaceAll("$1" + THIN_SPACE_D + "$2" + THIN_SPACE_D);
        result = SINGLE_DIFFERENTIAL_GLYPH.matcher(result).replaceAll("$1" + THIN_SPACE_D);
        result = DOUBLE_DIFFERENTIAL_LETTER.matcher(result).replaceAll("$1" + THIN_SPACE_D + "$2" + THIN_SPACE_D);
        return GREEK_DIFFERENTIAL_LETTER.matcher(result).replaceAll("$1" + THIN_SPACE_D + "$2");
    }
}
