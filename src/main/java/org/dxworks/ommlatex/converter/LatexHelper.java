package org.dxworks.ommlatex.converter;

import java.util.List;
import java.util.regex.Pattern;

/**
 * String-level building blocks shared by the node converter and the normalizer.
 */
public final class LatexHelper {

    private static final Pattern SINGLE_COMMAND = Pattern.compile("\\\\(?:[A-Za-z]+|[^A-Za-z\\s])");
    private static final Pattern ENDS_WITH_COMMAND = Pattern.compile("\\\\[A-Za-z]+$");
    private static final Pattern RIGHT_DELIMITER_TOKEN = Pattern.compile("[^\\\\\\s]|\\\\[A-Za-z]+|\\\\[{}|]");

    private static final String LEFT = "\\left";
    private static final String RIGHT = "\\right";

    private LatexHelper() {}

    public static String group(String content) {
        return "{" + (content != null ? content : "") + "}";
    }

    public static String superscript(String base, String exponent) {
        return scriptBase(base) + "^" + group(exponent);
    }

    public static String subscript(String base, String index) {
        return scriptBase(base) + "_" + group(index);
    }

    public static String subSuperscript(String base, String index, String exponent) {
        return scriptBase(base) + "_" + group(index) + "^" + group(exponent);
    }

    /**
     * Base of a script, brace-wrapped unless it already is a single self-delimiting unit.
     */
    public static String scriptBase(String base) {
        String trimmed = base != null ? base.trim() : "";
        return isSelfDelimiting(trimmed) ? trimmed : group(trimmed);
    }

    /**
     * True for a single character, a single command, one whole brace group or one whole
     * {@code \left...\right} group.
     */
    public static boolean isSelfDelimiting(String latex) {
        if (latex == null || latex.isEmpty()) return false;
        if (latex.codePointCount(0, latex.length()) == 1) return true;
        if (SINGLE_COMMAND.matcher(latex).matches()) return true;
        return isWholeBraceGroup(latex) || isWholeDelimitedGroup(latex);
    }

    public static boolean isWholeBraceGroup(String latex) {
        if (latex == null || latex.length() < 2 || latex.charAt(0) != '{' || latex.charAt(latex.length() - 1) != '}') {
            return false;
        }
        int depth = 0;
        for (int i = 0; i < latex.length(); i++) {
            char c = latex.charAt(i);
            if (c == '\\') {
                i++; // escaped character, e.g. \{ or \}
                continue;
            }
            if (c == '{') depth++;
            if (c == '}') {
                depth--;
                if (depth == 0 && i < latex.length() - 1) return false;
            }
        }
        return depth == 0;
    }

    /**
     * True when the text is exactly one {@code \left ... \right} pair, e.g. {@code \left(x+1\right)}.
     */
    public static boolean isWholeDelimitedGroup(String latex) {
        if (latex == null || !latex.startsWith(LEFT)) return false;
        int lastRight = latex.lastIndexOf(RIGHT);
        if (lastRight < 0) return false;
        String closing = latex.substring(lastRight + RIGHT.length());
        if (!RIGHT_DELIMITER_TOKEN.matcher(closing).matches()) return false;

        int depth = 0;
        int i = 0;
        while (i < latex.length()) {
            if (latex.startsWith(LEFT, i) && !isLetterAt(latex, i + LEFT.length())) {
                depth++;
                i += LEFT.length();
            } else if (latex.startsWith(RIGHT, i) && !isLetterAt(latex, i + RIGHT.length())) {
                depth--;
                if (depth == 0 && i != lastRight) return false;
                i += RIGHT.length();
            } else {
                i++;
            }
        }
        return depth == 0;
    }

    /** Parenthesized either literally or with scalable delimiters. */
    public static boolean isParenthesized(String latex) {
        if (latex == null) return false;
        if (latex.startsWith("\\left(") && latex.endsWith("\\right)")) {
            return isWholeDelimitedGroup(latex);
        }
        return latex.startsWith("(") && latex.endsWith(")") && balancedParentheses(latex);
    }

    /**
     * Joins sibling fragments. A space is kept between a fragment ending in a command name and
     * a following fragment starting with a letter.
     */
    public static String concat(List<String> fragments) {
        StringBuilder sb = new StringBuilder();
        for (String fragment : fragments) {
            if (fragment == null || fragment.isEmpty()) continue;
            if (sb.length() > 0 && Character.isLetter(fragment.charAt(0)) && endsWithCommand(sb)) {
                sb.append(' ');
            }
            sb.append(fragment);
        }
        return sb.toString();
    }

    public static boolean endsWithCommand(CharSequence latex) {
        return ENDS_WITH_COMMAND.matcher(latex).find();
    }

    public static int countOccurrences(String text, String token) {
        if (text == null || token == null || token.isEmpty()) return 0;
        int count = 0;
        int index = text.indexOf(token);
        while (index >= 0) {
            count++;
            index = text.indexOf(token, index + token.length());
        }
        return count;
    }

    private static boolean isLetterAt(String text, int index) {
        return index < text.length() && Character.isLetter(text.charAt(index));
    }

    private static boolean balancedParentheses(String latex) {
        int depth = 0;
        for (int i = 0; i < latex.length(); i++) {
            char c = latex.charAt(i);
            if (c == '(') depth++;
            if (c == ')') {
                depth--;
                if (depth == 0 && i < latex.length() - 1) return false;
            }
        }
        return depth == 0;
    }
}
