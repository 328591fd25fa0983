package org.dxworks.ommlatex.converter;

import org.dxworks.ommlatex.model.MathAttribute;
import org.dxworks.ommlatex.model.MathNode;
import org.dxworks.ommlatex.model.MathNodeKind;
import org.dxworks.ommlatex.model.MathRole;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.dxworks.ommlatex.converter.LatexHelper.group;

/**
 * Converts an equation tree to LaTeX.
 *
 * <p>Each node kind has its own rendering method; unknown kinds concatenate their children.
 * Rendering never fails on incomplete trees: a missing child renders as an empty string. The
 * {@link OutputNormalizer} runs once, on the output of the expression passed to
 * {@link #convert(MathNode)}.</p>
 *
 * <p>Instances hold no per-call state and can be shared between threads.</p>
 */
public class OmmlLatexConverter implements MathConverter {

    private static final String DEFAULT_NARY_OPERATOR = "\\sum";
    private static final String DEFAULT_ACCENT = "hat";
    private static final String ROW_SEPARATOR = " \\\\ ";
    private static final String CELL_SEPARATOR = " & ";

    private static final Map<String, String> ACCENTS = new HashMap<>();

    static {
        ACCENTS.put("\u0302", "hat");
        ACCENTS.put("\u0303", "tilde");
        ACCENTS.put("\u0304", "bar");
        ACCENTS.put("\u0307", "dot");
        ACCENTS.put("\u0308", "ddot");
        ACCENTS.put("\u20D7", "vec");
    }

    private final OutputNormalizer normalizer;

    public OmmlLatexConverter() {
        this(new OutputNormalizer());
    }

    public OmmlLatexConverter(OutputNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    @Override
    public String convert(MathNode expression) {
        return normalizer.normalize(render(expression));
    }

    /**
     * Renders a node without normalization.
     */
    public String render(MathNode node) {
        if (node == null) return "";

        switch (node.getKind()) {
            case RUN:
                return TextRunConverter.convert(node.getText());
            case PARAGRAPH:
                return renderParagraph(node);
            case FRACTION:
                return renderFraction(node, false);
            case SUPERSCRIPT:
                return renderSuperscript(node);
            case SUBSCRIPT:
                return LatexHelper.subscript(render(node.getChild(MathRole.BASE)),
                        render(node.getChild(MathRole.SUBSCRIPT)));
            case SUB_SUPERSCRIPT:
                return LatexHelper.subSuperscript(render(node.getChild(MathRole.BASE)),
                        render(node.getChild(MathRole.SUBSCRIPT)),
                        render(node.getChild(MathRole.SUPERSCRIPT)));
            case NARY:
                return renderNary(node);
            case RADICAL:
                return renderRadical(node);
            case DELIMITER:
                return renderDelimiter(node);
            case MATRIX:
                return renderMatrix(node, DelimiterGlyphs.PLAIN_MATRIX);
            case MATRIX_ROW:
                return renderMatrixRow(node);
            case FUNCTION:
                return renderFunction(node);
            case LIMIT_LOWER:
                return renderLimit(node, "_");
            case LIMIT_UPPER:
                return renderLimit(node, "^");
            case ACCENT:
                return renderAccent(node);
            case EQUATION_ARRAY:
                return renderEquationArray(node);
            case ROOT:
            case ARGUMENT:
            case UNKNOWN:
            default:
                return renderChildren(node);
        }
    }

    private String renderChildren(MathNode node) {
        List<String> fragments = new ArrayList<>(node.getChildren().size());
        for (MathNode child : node.getChildren()) {
            fragments.add(render(child));
        }
        return LatexHelper.concat(fragments);
    }

    private String renderParagraph(MathNode node) {
        List<String> lines = new ArrayList<>();
        for (MathNode child : node.getChildren()) {
            String line = render(child);
            if (!line.isBlank()) {
                lines.add(line);
            }
        }
        return String.join(ROW_SEPARATOR, lines);
    }

    /**
     * A fraction of two single letters is a binomial coefficient when the letters are n and k,
     * or when the fraction is all a delimiter group holds. Everything else is a {@code \frac}
     * with both operands braced.
     */
    private String renderFraction(MathNode node, boolean soleDelimiterContent) {
        String numerator = render(node.getChild(MathRole.NUMERATOR)).trim();
        String denominator = render(node.getChild(MathRole.DENOMINATOR)).trim();

        if (isBinomial(numerator, denominator, soleDelimiterContent)) {
            return "\\binom" + group(numerator) + group(denominator);
        }
        return "\\frac" + group(numerator) + group(denominator);
    }

    private static boolean isBinomial(String numerator, String denominator, boolean soleDelimiterContent) {
        if (numerator.length() != 1 || denominator.length() != 1) return false;
        if (!Character.isLetter(numerator.charAt(0)) || !Character.isLetter(denominator.charAt(0))) return false;
        return ("n".equals(numerator) && "k".equals(denominator)) || soleDelimiterContent;
    }

    private String renderSuperscript(MathNode node) {
        String base = collapseDuplicatedIntegrals(render(node.getChild(MathRole.BASE)).trim());
        return LatexHelper.superscript(base, render(node.getChild(MathRole.SUPERSCRIPT)));
    }

    /**
     * A bracketed base can come out with its integrals emitted twice. More than two integrals
     * in a {@code \left[} base are cut back to the first two and the bracket is closed again.
     */
    static String collapseDuplicatedIntegrals(String base) {
        if (!base.startsWith("\\left[") || LatexHelper.countOccurrences(base, "\\int") <= 2) {
            return base;
        }
        int first = base.indexOf("\\int");
        int second = base.indexOf("\\int", first + 1);
        int third = base.indexOf("\\int", second + 1);

        String kept = base.substring(0, third).trim();
        if (kept.endsWith("\\right]")) {
            return kept;
        }
        return kept + "\\right]";
    }

    private String renderNary(MathNode node) {
        String glyph = node.getAttribute(MathAttribute.OPERATOR_CHAR);
        String operator = glyph == null || glyph.isEmpty()
                ? DEFAULT_NARY_OPERATOR
                : SymbolTable.substitute(glyph);

        StringBuilder result = new StringBuilder(operator);
        appendLimit(result, "_", node.getChild(MathRole.SUBSCRIPT), node.isFlagSet(MathAttribute.SUB_HIDDEN));
        appendLimit(result, "^", node.getChild(MathRole.SUPERSCRIPT), node.isFlagSet(MathAttribute.SUP_HIDDEN));

        String operand = render(node.getChild(MathRole.BASE)).trim();
        if (!operand.isEmpty()) {
            result.append(' ').append(operand);
        }
        return result.toString();
    }

    private void appendLimit(StringBuilder result, String marker, MathNode limit, boolean hidden) {
        if (limit == null || hidden) return;
        String rendered = render(limit).trim();
        if (!rendered.isEmpty()) {
            result.append(marker).append(group(rendered));
        }
    }

    private String renderRadical(MathNode node) {
        String radicand = render(node.getChild(MathRole.BASE));
        MathNode degree = node.getChild(MathRole.DEGREE);

        if (node.isFlagSet(MathAttribute.DEGREE_HIDDEN) || degree == null) {
            return "\\sqrt" + group(radicand);
        }
        String index = render(degree).trim();
        if (index.isEmpty()) {
            return "\\sqrt" + group(radicand);
        }
        return "\\sqrt[" + index + "]" + group(radicand);
    }

    private String renderDelimiter(MathNode node) {
        String open = node.getAttribute(MathAttribute.BEGIN_CHAR, DelimiterGlyphs.DEFAULT_OPEN);
        String close = node.getAttribute(MathAttribute.END_CHAR, DelimiterGlyphs.DEFAULT_CLOSE);

        List<MathNode> operands = node.getChildren(MathNodeKind.ARGUMENT);
        if (operands.isEmpty()) return "";
        MathNode first = operands.get(0);

        MathNode matrix = first.findFirstChild(MathNodeKind.MATRIX);
        if (matrix != null) {
            return renderMatrix(matrix, DelimiterGlyphs.matrixEnvironment(open));
        }

        MathNode equationArray = first.findFirstChild(MathNodeKind.EQUATION_ARRAY);
        if (equationArray != null) {
            String rows = renderEquationArray(equationArray);
            if ("{".equals(open) && close.isEmpty()) {
                return "\\begin{cases} " + rows + " \\end{cases}";
            }
            return rows;
        }

        if (operands.size() == 1 && first.getChildren().size() == 1
                && first.getChildren().get(0).getKind() == MathNodeKind.FRACTION) {
            String fraction = renderFraction(first.getChildren().get(0), true);
            if (fraction.startsWith("\\binom") && "(".equals(open) && ")".equals(close)) {
                return fraction;
            }
            return DelimiterGlyphs.wrap(open, close, fraction);
        }

        String separator = node.getAttribute(MathAttribute.SEPARATOR_CHAR, DelimiterGlyphs.DEFAULT_SEPARATOR);
        List<String> parts = new ArrayList<>(operands.size());
        for (MathNode operand : operands) {
            parts.add(render(operand));
        }
        return DelimiterGlyphs.wrap(open, close, String.join(separator, parts));
    }

    private String renderMatrix(MathNode matrix, String environment) {
        List<String> rows = new ArrayList<>();
        for (MathNode row : matrix.getChildren(MathNodeKind.MATRIX_ROW)) {
            rows.add(renderMatrixRow(row));
        }
        if (rows.isEmpty()) return "";
        return "\\begin" + group(environment) + " " + String.join(ROW_SEPARATOR, rows)
                + " \\end" + group(environment);
    }

    private String renderMatrixRow(MathNode row) {
        List<String> cells = new ArrayList<>();
        for (MathNode cell : row.getChildren(MathNodeKind.ARGUMENT)) {
            cells.add(render(cell).trim());
        }
        return String.join(CELL_SEPARATOR, cells);
    }

    private String renderFunction(MathNode node) {
        MathNode name = node.getChild(MathRole.FUNCTION_NAME);
        String argument = render(node.getChild(MathRole.BASE)).trim();

        if (name != null && name.containsDescendant(MathNodeKind.LIMIT_LOWER)) {
            String limit = render(name).trim();
            if (!argument.isEmpty() && !argument.contains("\\lim")) {
                return limit + " " + argument;
            }
            return limit;
        }

        String functionName = render(name).trim();
        if (!functionName.isEmpty() && !functionName.startsWith("\\")) {
            functionName = FunctionNames.substitute(functionName);
        }

        if (functionName.isEmpty()) return argument;
        if (argument.isEmpty()) return functionName;
        // limits are never parenthesized
        if (functionName.toLowerCase().contains("lim")) {
            return functionName + " " + argument;
        }
        if (LatexHelper.isParenthesized(argument)) {
            return functionName + argument;
        }
        return functionName + "(" + argument + ")";
    }

    private String renderLimit(MathNode node, String marker) {
        String base = render(node.getChild(MathRole.BASE)).trim();
        String limit = render(node.getChild(MathRole.LIMIT)).trim();

        if ("lim".equals(base)) {
            base = "\\lim";
        } else if (!base.startsWith("\\")) {
            base = FunctionNames.substitute(base);
        }
        return base + marker + group(limit);
    }

    private String renderAccent(MathNode node) {
        String accent = ACCENTS.getOrDefault(node.getAttribute(MathAttribute.ACCENT_CHAR, ""), DEFAULT_ACCENT);
        return "\\" + accent + group(render(node.getChild(MathRole.BASE)));
    }

    /**
     * Rows of a piecewise definition. Each row is split on its first comma into value and
     * condition; parity conditions are set as text.
     */
    private String renderEquationArray(MathNode node) {
        List<String> rows = new ArrayList<>();
        for (MathNode row : node.getChildren(MathNodeKind.ARGUMENT)) {
            String part = render(row).trim();
            if (!part.isEmpty()) {
                rows.add(formatCase(part));
            }
        }
        return String.join(ROW_SEPARATOR, rows);
    }

    static String formatCase(String row) {
        int comma = row.indexOf(',');
        if (comma < 0) return row;

        String value = row.substring(0, comma).trim();
        String condition = row.substring(comma + 1).trim();
        if (condition.startsWith("&")) {
            condition = condition.substring(1).trim();
        }
        if (condition.isEmpty()) return value;

        if (condition.contains("odd") || condition.contains("even")) {
            return value + ", & \\text" + group(condition);
        }
        return value + ", & " + condition;
    }
}
