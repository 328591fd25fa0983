package org.dxworks.ommlatex.converter;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text-level cleanup of a converted expression.
 *
 * <p>The rules run in a fixed order. The whole rule set is repeated until the output stops
 * changing (at most {@value #MAX_PASSES} passes), so normalizing twice gives the same result as
 * normalizing once.</p>
 */
public class OutputNormalizer {

    static final int MAX_PASSES = 5;

    // whole command names only: \leftarrow and \rightarrow are not delimiters
    private static final Pattern COMPLEX_MARKER = Pattern.compile("\\\\(?:binom|left|right|begin)(?![A-Za-z])");

    private static final Pattern DOUBLE_BRACES = Pattern.compile("\\{\\{([^{}]+)\\}\\}");
    // not an argument: no command name, script marker, digit or closing brace/bracket before it
    private static final Pattern SINGLE_CHARACTER_GROUP =
            Pattern.compile("(?<![\\^_}\\]A-Za-z0-9\\\\])\\{([A-Za-z0-9])\\}");
    private static final Pattern SPACE_BEFORE_SCRIPT = Pattern.compile("\\s+([_^])");

    private static final Pattern COMMAND = Pattern.compile("\\\\([a-zA-Z]+)");
    private static final List<String> GLUEABLE_COMMANDS = List.of(
            "rightarrow", "leftarrow", "Rightarrow", "upsilon", "partial",
            "forall", "exists", "alpha", "gamma", "delta", "theta", "sigma", "beta", "cdot");
    private static final Pattern RELATION_BEFORE_DIGIT = Pattern.compile("(\\\\approx|\\\\equiv|\\\\sim)(\\d)");

    private static final Pattern FRACTION_WITHOUT_BRACES = Pattern.compile("\\\\frac([A-Za-z0-9])\\{");

    private static final Pattern BINOMIAL_WITHOUT_BRACES = Pattern.compile("\\\\binom([a-zA-Z])([a-zA-Z])");
    private static final Pattern PARENTHESIZED_BINOMIAL =
            Pattern.compile("\\\\left\\(\\\\binom\\{([^{}]*)\\}\\{([^{}]*)\\}\\\\right\\)");
    private static final Pattern DUPLICATED_EXPONENTIAL = Pattern.compile("(e\\^\\{[^{}]+\\}[a-z]+)\\s*\\1");
    private static final Pattern DUPLICATED_FUNCTION_NAME = Pattern.compile(
            "(?<![A-Za-z])(\\\\?[A-Za-z]{2,})\\\\left\\(([^()]*)\\\\right\\)\\1(?=\\s*$|\\s*[=+\\-,;)\\]])");
    private static final Pattern DUPLICATED_LIMIT = Pattern.compile("(\\\\lim[^}]*\\})\\s*\\\\lim\\s");

    private final Set<String> knownCommands;

    public OutputNormalizer() {
        Set<String> commands = new HashSet<>();
        for (String latex : SymbolTable.entries().values()) {
            Matcher matcher = COMMAND.matcher(latex);
            while (matcher.find()) {
                commands.add(matcher.group(1));
            }
        }
        commands.addAll(FunctionNames.names());
        commands.add("cdots");
        this.knownCommands = commands;
    }

    public String normalize(String latex) {
        if (latex == null || latex.isEmpty()) return "";

        String current = latex;
        for (int pass = 0; pass < MAX_PASSES; pass++) {
            String next = applyRules(current);
            if (next.equals(current)) {
                return next;
            }
            current = next;
        }
        return current;
    }

    private String applyRules(String latex) {
        String result = latex;
        if (!containsComplexMarker(result)) {
            result = stripRedundantBraces(result);
        }
        result = SPACE_BEFORE_SCRIPT.matcher(result).replaceAll("$1");
        result = separateGluedCommands(result.replace("\u22C5", "\\cdot"));
        result = FRACTION_WITHOUT_BRACES.matcher(result).replaceAll("\\\\frac{$1}{");
        return fixDuplicates(result);
    }

    static boolean containsComplexMarker(String latex) {
        return COMPLEX_MARKER.matcher(latex).find();
    }

    static String stripRedundantBraces(String latex) {
        String result = DOUBLE_BRACES.matcher(latex).replaceAll("{$1}");
        return SINGLE_CHARACTER_GROUP.matcher(result).replaceAll("$1");
    }

    /**
     * Splits a command glued to the following letters, e.g. {@code \alphax} into
     * {@code \alpha x}. Command names found in the symbol and function tables are left alone.
     */
    String separateGluedCommands(String latex) {
        Matcher matcher = COMMAND.matcher(latex);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1);
            String replacement = matcher.group();
            if (!knownCommands.contains(name)) {
                String prefix = gluedPrefix(name);
                if (prefix != null) {
                    replacement = "\\" + prefix + " " + name.substring(prefix.length());
                }
            }
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(sb);
        return RELATION_BEFORE_DIGIT.matcher(sb.toString()).replaceAll("$1 $2");
    }

    private static String gluedPrefix(String name) {
        for (String command : GLUEABLE_COMMANDS) {
            if (name.length() > command.length() && name.startsWith(command)) {
                return command;
            }
        }
        return null;
    }

    static String fixDuplicates(String latex) {
        String result = BINOMIAL_WITHOUT_BRACES.matcher(latex).replaceAll("\\\\binom{$1}{$2}");
        result = PARENTHESIZED_BINOMIAL.matcher(result).replaceAll("\\\\binom{$1}{$2}");
        result = DUPLICATED_EXPONENTIAL.matcher(result).replaceAll("$1");
        result = DUPLICATED_FUNCTION_NAME.matcher(result).replaceAll("$1\\\\left($2\\\\right)");
        return DUPLICATED_LIMIT.matcher(result).replaceAll("$1 ");
    }
}
