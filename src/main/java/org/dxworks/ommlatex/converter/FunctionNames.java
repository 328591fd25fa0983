package org.dxworks.ommlatex.converter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Function names typeset upright by LaTeX ({@code sin} becomes {@code \sin}).
 */
public final class FunctionNames {

    private static final List<String> NAMES = List.of(
            "sin", "cos", "tan", "sec", "csc", "cot",
            "arcsin", "arccos", "arctan",
            "sinh", "cosh", "tanh", "coth",
            "log", "ln", "lg", "exp",
            "lim", "sup", "inf", "min", "max",
            "det", "dim", "gcd", "deg", "arg"
    );

    private static final Map<String, Pattern> PATTERNS = new LinkedHashMap<>();

    static {
        List<String> longestFirst = new ArrayList<>(NAMES);
        longestFirst.sort(Comparator.comparingInt(String::length).reversed());
        for (String name : longestFirst) {
            // whole identifier only, followed by whitespace, an opening parenthesis or the end
            PATTERNS.put(name, Pattern.compile("(?<![\\\\A-Za-z])" + name + "(?=\\s|\\(|$)"));
        }
    }

    private FunctionNames() {}

    public static Set<String> names() {
        return Collections.unmodifiableSet(PATTERNS.keySet());
    }

    static boolean isFunctionName(String name) {
        return name != null && PATTERNS.containsKey(name.trim());
    }

    /**
     * Replaces bare function names by their commands. Text that already starts with a command
     * is returned unchanged.
     */
    public static String substitute(String text) {
        if (text == null || text.isEmpty()) return "";
        if (text.startsWith("\\")) return text;

        String result = text;
        for (Map.Entry<String, Pattern> entry : PATTERNS.entrySet()) {
            Matcher matcher = entry.getValue().matcher(result);
            if (matcher.find()) {
                result = matcher.replaceAll(Matcher.quoteReplacement("\\" + entry.getKey()));
            }
        }
        return result;
    }
}
