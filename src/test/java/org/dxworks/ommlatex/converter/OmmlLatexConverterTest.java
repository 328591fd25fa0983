package org.dxworks.ommlatex.converter;

import org.dxworks.ommlatex.model.MathAttribute;
import org.dxworks.ommlatex.model.MathNode;
import org.dxworks.ommlatex.model.MathNodeKind;
import org.dxworks.ommlatex.model.MathRole;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OmmlLatexConverterTest {

    private final OmmlLatexConverter converter = new OmmlLatexConverter();

    // ---- tree builders ----

    private static MathNode r(String text) {
        return MathNode.run(text);
    }

    private static MathNode arg(MathNode... children) {
        MathNode.Builder builder = MathNode.builder(MathNodeKind.ARGUMENT);
        for (MathNode child : children) {
            builder.child(child);
        }
        return builder.build();
    }

    private static MathNode arg(String text) {
        return arg(r(text));
    }

    private static MathNode root(MathNode... children) {
        MathNode.Builder builder = MathNode.builder(MathNodeKind.ROOT);
        for (MathNode child : children) {
            builder.child(child);
        }
        return builder.build();
    }

    private static MathNode fraction(String numerator, String denominator) {
        return MathNode.builder(MathNodeKind.FRACTION)
                .child(MathRole.NUMERATOR, arg(numerator))
                .child(MathRole.DENOMINATOR, arg(denominator))
                .build();
    }

    private static MathNode superscript(MathNode base, String exponent) {
        return MathNode.builder(MathNodeKind.SUPERSCRIPT)
                .child(MathRole.BASE, arg(base))
                .child(MathRole.SUPERSCRIPT, arg(exponent))
                .build();
    }

    private static MathNode subscript(String base, String index) {
        return MathNode.builder(MathNodeKind.SUBSCRIPT)
                .child(MathRole.BASE, arg(base))
                .child(MathRole.SUBSCRIPT, arg(index))
                .build();
    }

    private static MathNode delimiter(String open, String close, MathNode... operands) {
        MathNode.Builder builder = MathNode.builder(MathNodeKind.DELIMITER)
                .attribute(MathAttribute.BEGIN_CHAR, open)
                .attribute(MathAttribute.END_CHAR, close);
        for (MathNode operand : operands) {
            builder.child(MathRole.BASE, operand);
        }
        return builder.build();
    }

    private static MathNode matrix(String[]... rows) {
        MathNode.Builder matrix = MathNode.builder(MathNodeKind.MATRIX);
        for (String[] cells : rows) {
            MathNode.Builder row = MathNode.builder(MathNodeKind.MATRIX_ROW);
            for (String cell : cells) {
                row.child(MathRole.BASE, cell.isEmpty() ? arg() : arg(cell));
            }
            matrix.child(row.build());
        }
        return matrix.build();
    }

    private static MathNode equationArray(String... rows) {
        MathNode.Builder builder = MathNode.builder(MathNodeKind.EQUATION_ARRAY);
        for (String row : rows) {
            builder.child(MathRole.BASE, arg(row));
        }
        return builder.build();
    }

    private static MathNode function(MathNode name, MathNode argument) {
        return MathNode.builder(MathNodeKind.FUNCTION)
                .child(MathRole.FUNCTION_NAME, name)
                .child(MathRole.BASE, argument)
                .build();
    }

    private static MathNode limitLower(String base, String limit) {
        return MathNode.builder(MathNodeKind.LIMIT_LOWER)
                .child(MathRole.BASE, arg(base))
                .child(MathRole.LIMIT, arg(limit))
                .build();
    }

    private static MathNode nary(String glyph, MathNode lower, MathNode upper, MathNode operand) {
        return MathNode.builder(MathNodeKind.NARY)
                .attribute(MathAttribute.OPERATOR_CHAR, glyph)
                .child(MathRole.SUBSCRIPT, lower)
                .child(MathRole.SUPERSCRIPT, upper)
                .child(MathRole.BASE, operand)
                .build();
    }

    private static MathNode accent(String glyph, String base) {
        return MathNode.builder(MathNodeKind.ACCENT)
                .attribute(MathAttribute.ACCENT_CHAR, glyph)
                .child(MathRole.BASE, arg(base))
                .build();
    }

    // ---- end-to-end scenarios ----

    @Test
    void fractionOutsideDelimiter() {
        assertEquals("\\frac{1}{2}", converter.convert(root(fraction("1", "2"))));
    }

    @Test
    void superscript() {
        assertEquals("x^{2}", converter.convert(root(superscript(r("x"), "2"))));
    }

    @Test
    void radicalWithoutDegree() {
        MathNode radical = MathNode.builder(MathNodeKind.RADICAL)
                .child(MathRole.BASE, arg("a+b"))
                .build();
        assertEquals("\\sqrt{a+b}", converter.convert(root(radical)));
    }

    @Test
    void summationWithLimits() {
        MathNode sum = nary("∑", arg("k=0"), arg("n"), arg("k"));
        assertEquals("\\sum_{k=0}^{n} k", converter.convert(root(sum)));
    }

    @Test
    void delimitedLetterFractionIsBinomial() {
        MathNode binomial = delimiter("(", ")", arg(fraction("n", "k")));
        assertEquals("\\binom{n}{k}", converter.convert(root(binomial)));
    }

    // ---- fractions ----

    @Test
    void bareNOverKIsBinomial() {
        assertEquals("\\binom{n}{k}", converter.convert(root(fraction("n", "k"))));
    }

    @Test
    void bareLetterFractionStaysFraction() {
        assertEquals("\\frac{a}{b}", converter.convert(root(fraction("a", "b"))));
    }

    @Test
    void binomialInsideBracketsKeepsBrackets() {
        MathNode bracketed = delimiter("[", "]", arg(fraction("a", "b")));
        assertEquals("\\left[\\binom{a}{b}\\right]", converter.convert(root(bracketed)));
    }

    @Test
    void fractionWithoutChildrenRendersEmptyGroups() {
        assertEquals("\\frac{}{}", converter.convert(root(MathNode.builder(MathNodeKind.FRACTION).build())));
    }

    // ---- scripts ----

    @Test
    void subscriptAndSubSuperscript() {
        MathNode subSup = MathNode.builder(MathNodeKind.SUB_SUPERSCRIPT)
                .child(MathRole.BASE, arg("x"))
                .child(MathRole.SUBSCRIPT, arg("i"))
                .child(MathRole.SUPERSCRIPT, arg("2"))
                .build();

        assertEquals("x_{i}", converter.convert(root(subscript("x", "i"))));
        assertEquals("x_{i}^{2}", converter.convert(root(subSup)));
    }

    @Test
    void compoundScriptBaseIsBraced() {
        assertEquals("{x+y}_{1}", converter.convert(root(subscript("x+y", "1"))));
    }

    @Test
    void superscriptOfSubscriptNestsLikeTheIndividualConversions() {
        MathNode nested = superscript(subscript("x", "i"), "2");
        String expected = LatexHelper.superscript(LatexHelper.subscript("x", "i"), "2");

        assertEquals("{x_{i}}^{2}", expected);
        assertEquals(expected, converter.convert(root(nested)));
    }

    @Test
    void repeatedIntegralsInBracketedBaseAreCollapsed() {
        assertEquals("\\left[\\int a \\int b\\right]",
                OmmlLatexConverter.collapseDuplicatedIntegrals("\\left[\\int a \\int b \\int a \\int b\\right]"));
        assertEquals("\\left[\\int a \\int b\\right]",
                OmmlLatexConverter.collapseDuplicatedIntegrals("\\left[\\int a \\int b\\right]"));
        assertEquals("\\int a \\int b \\int c",
                OmmlLatexConverter.collapseDuplicatedIntegrals("\\int a \\int b \\int c"));
    }

    // ---- n-ary operators ----

    @Test
    void naryWithoutGlyphDefaultsToSum() {
        MathNode sum = nary(null, arg("i=1"), arg("n"), arg("i"));
        assertEquals("\\sum_{i=1}^{n} i", converter.convert(root(sum)));
    }

    @Test
    void emptyLimitsAreLeftOut() {
        MathNode integral = nary("∫", arg(), arg(), arg("x"));
        assertEquals("\\int x", converter.convert(root(integral)));
    }

    @Test
    void hiddenLimitIsLeftOut() {
        MathNode integral = MathNode.builder(MathNodeKind.NARY)
                .attribute(MathAttribute.OPERATOR_CHAR, "∫")
                .attribute(MathAttribute.SUB_HIDDEN, "1")
                .child(MathRole.SUBSCRIPT, arg("0"))
                .child(MathRole.SUPERSCRIPT, arg("1"))
                .child(MathRole.BASE, arg("x"))
                .build();
        assertEquals("\\int^{1} x", converter.convert(root(integral)));
    }

    @Test
    void productOperator() {
        MathNode product = nary("∏", arg("i"), null, arg("a_i"));
        assertEquals("\\prod_{i} a_i", converter.convert(root(product)));
    }

    // ---- radicals ----

    @Test
    void radicalWithVisibleDegree() {
        MathNode cubeRoot = MathNode.builder(MathNodeKind.RADICAL)
                .child(MathRole.DEGREE, arg("3"))
                .child(MathRole.BASE, arg("x"))
                .build();
        assertEquals("\\sqrt[3]{x}", converter.convert(root(cubeRoot)));
    }

    @Test
    void hiddenDegreeIsIgnored() {
        MathNode radical = MathNode.builder(MathNodeKind.RADICAL)
                .attribute(MathAttribute.DEGREE_HIDDEN, "on")
                .child(MathRole.DEGREE, arg("3"))
                .child(MathRole.BASE, arg("x"))
                .build();
        assertEquals("\\sqrt{x}", converter.convert(root(radical)));
    }

    // ---- delimiters ----

    @Test
    void multipleOperandsUseSeparator() {
        MathNode pair = delimiter("(", ")", arg("a"), arg("b"));
        MathNode commaSeparated = MathNode.builder(MathNodeKind.DELIMITER)
                .attribute(MathAttribute.SEPARATOR_CHAR, ",")
                .child(MathRole.BASE, arg("a"))
                .child(MathRole.BASE, arg("b"))
                .build();

        assertEquals("\\left(a|b\\right)", converter.convert(root(pair)));
        assertEquals("\\left(a,b\\right)", converter.convert(root(commaSeparated)));
    }

    @Test
    void angleBracketsAreSpacedFromLetters() {
        assertEquals("\\left\\langle x\\right\\rangle", converter.convert(root(delimiter("⟨", "⟩", arg("x")))));
    }

    @Test
    void emptyClosingGlyphBecomesInvisibleDelimiter() {
        assertEquals("\\left|x\\right.", converter.convert(root(delimiter("|", "", arg("x")))));
    }

    @Test
    void glyphWithoutScalableFormIsEmittedLiterally() {
        assertEquals("⟦x⟧", converter.convert(root(delimiter("⟦", "⟧", arg("x")))));
    }

    @Test
    void literalBraceNextToAnUnscalableGlyphIsEscaped() {
        assertEquals("\\{x⟧", converter.convert(root(delimiter("{", "⟧", arg("x")))));
        assertEquals("⟦x\\}", converter.convert(root(delimiter("⟦", "}", arg("x")))));
    }

    @Test
    void delimiterWithoutOperandsRendersNothing() {
        assertEquals("", converter.convert(root(delimiter("(", ")"))));
    }

    // ---- matrices ----

    @Test
    void matrixEnvironmentFollowsOpeningGlyph() {
        String[] first = {"a", "b"};
        String[] second = {"c", "d"};

        assertEquals("\\begin{pmatrix} a & b \\\\ c & d \\end{pmatrix}",
                converter.convert(root(delimiter("(", ")", arg(matrix(first, second))))));
        assertEquals("\\begin{bmatrix} a & b \\\\ c & d \\end{bmatrix}",
                converter.convert(root(delimiter("[", "]", arg(matrix(first, second))))));
        assertEquals("\\begin{Bmatrix} a & b \\\\ c & d \\end{Bmatrix}",
                converter.convert(root(delimiter("{", "}", arg(matrix(first, second))))));
        assertEquals("\\begin{vmatrix} a & b \\\\ c & d \\end{vmatrix}",
                converter.convert(root(delimiter("|", "|", arg(matrix(first, second))))));
        assertEquals("\\begin{Vmatrix} a & b \\\\ c & d \\end{Vmatrix}",
                converter.convert(root(delimiter("‖", "‖", arg(matrix(first, second))))));
    }

    @Test
    void undelimitedMatrixIsPlain() {
        assertEquals("\\begin{matrix} 1 & 0 \\\\ 0 & 1 \\end{matrix}",
                converter.convert(root(matrix(new String[]{"1", "0"}, new String[]{"0", "1"}))));
    }

    @Test
    void emptyCellsAreKept() {
        MathNode m = matrix(new String[]{"a", ""}, new String[]{"c", "d"});
        assertEquals("\\begin{pmatrix} a &  \\\\ c & d \\end{pmatrix}",
                converter.convert(root(delimiter("(", ")", arg(m)))));
    }

    // ---- equation arrays ----

    @Test
    void braceWithoutClosingGlyphAroundEquationArrayIsCases() {
        MathNode cases = delimiter("{", "", arg(equationArray("x, x>0", "−x, &x<0")));
        assertEquals("\\begin{cases} x, & x>0 \\\\ -x, & x<0 \\end{cases}", converter.convert(root(cases)));
    }

    @Test
    void parityConditionsAreSetAsText() {
        MathNode cases = delimiter("{", "", arg(equationArray("1, n even", "0, n odd")));
        assertEquals("\\begin{cases} 1, & \\text{n even} \\\\ 0, & \\text{n odd} \\end{cases}",
                converter.convert(root(cases)));
    }

    @Test
    void equationArrayInOtherDelimiterIsBare() {
        MathNode rows = delimiter("(", ")", arg(equationArray("a", "b")));
        assertEquals("a \\\\ b", converter.convert(root(rows)));
    }

    @Test
    void caseRowFormatting() {
        assertEquals("x", OmmlLatexConverter.formatCase("x"));
        assertEquals("x", OmmlLatexConverter.formatCase("x, "));
        assertEquals("x, & y>0", OmmlLatexConverter.formatCase("x ,& y>0"));
        assertEquals("2, & \\text{if n is odd}", OmmlLatexConverter.formatCase("2, if n is odd"));
    }

    // ---- functions and limits ----

    @Test
    void functionArgumentIsParenthesized() {
        assertEquals("\\sin(x)", converter.convert(root(function(arg("sin"), arg("x")))));
        assertEquals("f(x)", converter.convert(root(function(arg("f"), arg("x")))));
    }

    @Test
    void parenthesizedArgumentIsNotWrappedAgain() {
        MathNode cosine = function(arg("cos"), arg(delimiter("(", ")", arg("x"))));
        assertEquals("\\cos\\left(x\\right)", converter.convert(root(cosine)));
    }

    @Test
    void emptyFunctionNameLeavesArgument() {
        assertEquals("x", converter.convert(root(function(arg(), arg("x")))));
    }

    @Test
    void limitFunctionIsNotParenthesized() {
        assertEquals("\\lim x", converter.convert(root(function(arg("lim"), arg("x")))));
    }

    @Test
    void functionNamedByLowerLimit() {
        MathNode limit = function(arg(limitLower("lim", "n→∞")), arg(fraction("1", "n")));
        assertEquals("\\lim_{n\\rightarrow\\infty} \\frac{1}{n}", converter.convert(root(limit)));
    }

    @Test
    void nestedLimitArgumentIsDropped() {
        MathNode inner = function(arg(limitLower("lim", "x")), arg("y"));
        MathNode outer = function(arg(limitLower("lim", "n")), arg(inner));
        assertEquals("\\lim_{n}", converter.convert(root(outer)));
    }

    @Test
    void standaloneLimits() {
        MathNode upper = MathNode.builder(MathNodeKind.LIMIT_UPPER)
                .child(MathRole.BASE, arg("x"))
                .child(MathRole.LIMIT, arg("n"))
                .build();

        assertEquals("\\max_{i}", converter.convert(root(limitLower("max", "i"))));
        assertEquals("x^{n}", converter.convert(root(upper)));
    }

    // ---- accents ----

    @Test
    void accentsByGlyph() {
        assertEquals("\\hat{a}", converter.convert(root(accent("\u0302", "a"))));
        assertEquals("\\tilde{a}", converter.convert(root(accent("\u0303", "a"))));
        assertEquals("\\bar{a}", converter.convert(root(accent("\u0304", "a"))));
        assertEquals("\\dot{a}", converter.convert(root(accent("\u0307", "a"))));
        assertEquals("\\ddot{a}", converter.convert(root(accent("\u0308", "a"))));
        assertEquals("\\vec{v}", converter.convert(root(accent("\u20D7", "v"))));
    }

    @Test
    void unknownOrMissingAccentIsHat() {
        assertEquals("\\hat{x}", converter.convert(root(accent(null, "x"))));
        assertEquals("\\hat{x}", converter.convert(root(accent("~", "x"))));
    }

    // ---- containers ----

    @Test
    void siblingCommandAndLetterAreSeparated() {
        assertEquals("2\\pi r", converter.convert(root(r("2π"), r("r"))));
    }

    @Test
    void paragraphJoinsExpressionsAsLines() {
        MathNode paragraph = MathNode.builder(MathNodeKind.PARAGRAPH)
                .child(root(r("a=b")))
                .child(root())
                .child(root(r("c=d")))
                .build();
        assertEquals("a=b \\\\ c=d", converter.convert(paragraph));
    }

    @Test
    void unknownNodeConcatenatesChildren() {
        MathNode box = MathNode.builder(MathNodeKind.UNKNOWN).tag("box")
                .child(r("a"))
                .child(r("+b"))
                .build();
        assertEquals("a+b", converter.convert(root(box)));
    }

    @Test
    void nullAndEmptyTreesRenderEmpty() {
        assertEquals("", converter.convert(null));
        assertEquals("", converter.convert(root()));
    }

    @Test
    void convertsEveryExpressionOfAList() {
        List<MathNode> expressions = List.of(root(fraction("1", "2")), root(superscript(r("x"), "2")));
        assertEquals("\\frac{1}{2}", converter.convert(expressions.get(0)));
        assertEquals("x^{2}", converter.convert(expressions.get(1)));
    }
}
