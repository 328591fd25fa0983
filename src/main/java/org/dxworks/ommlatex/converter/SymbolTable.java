package org.dxworks.ommlatex.converter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Glyph to LaTeX command mapping for single math characters.
 *
 * <p>Substitution scans the text left to right and tries the longest glyph first at each
 * position. When a substituted command ends in a command name and a letter follows, a space is
 * inserted so that the command and the identifier do not merge into one token.</p>
 */
public final class SymbolTable {

    private static final Map<String, String> SYMBOLS = new LinkedHashMap<>();
    private static final List<String> GLYPHS_LONGEST_FIRST;
    private static final Pattern ENDS_WITH_COMMAND = Pattern.compile("\\\\[A-Za-z]+$");

    static {
        // relations and operators
        SYMBOLS.put("≠", "\\neq");
        SYMBOLS.put("≤", "\\leq");
        SYMBOLS.put("≥", "\\geq");
        SYMBOLS.put("≪", "\\ll");
        SYMBOLS.put("≫", "\\gg");
        SYMBOLS.put("±", "\\pm");
        SYMBOLS.put("∓", "\\mp");
        SYMBOLS.put("×", "\\times");
        SYMBOLS.put("÷", "\\div");
        SYMBOLS.put("·", "\\cdot");
        SYMBOLS.put("⋅", "\\cdot");
        SYMBOLS.put("∘", "\\circ");
        SYMBOLS.put("≈", "\\approx");
        SYMBOLS.put("≡", "\\equiv");
        SYMBOLS.put("≅", "\\cong");
        SYMBOLS.put("∼", "\\sim");
        SYMBOLS.put("∝", "\\propto");
        SYMBOLS.put("∈", "\\in");
        SYMBOLS.put("∉", "\\notin");
        SYMBOLS.put("∋", "\\ni");
        SYMBOLS.put("⊂", "\\subset");
        SYMBOLS.put("⊃", "\\supset");
        SYMBOLS.put("⊆", "\\subseteq");
        SYMBOLS.put("⊇", "\\supseteq");
        SYMBOLS.put("∪", "\\cup");
        SYMBOLS.put("∩", "\\cap");
        SYMBOLS.put("∖", "\\setminus");
        SYMBOLS.put("∅", "\\emptyset");
        SYMBOLS.put("∧", "\\land");
        SYMBOLS.put("∨", "\\lor");
        SYMBOLS.put("¬", "\\neg");
        SYMBOLS.put("∀", "\\forall");
        SYMBOLS.put("∃", "\\exists");
        SYMBOLS.put("→", "\\rightarrow");
        SYMBOLS.put("←", "\\leftarrow");
        SYMBOLS.put("↔", "\\leftrightarrow");
        SYMBOLS.put("⇒", "\\Rightarrow");
        SYMBOLS.put("⇐", "\\Leftarrow");
        SYMBOLS.put("⇔", "\\Leftrightarrow");
        SYMBOLS.put("↦", "\\mapsto");
        SYMBOLS.put("∂", "\\partial");
        SYMBOLS.put("∇", "\\nabla");
        SYMBOLS.put("∞", "\\infty");
        SYMBOLS.put("√", "\\sqrt");
        SYMBOLS.put("∠", "\\angle");
        SYMBOLS.put("⊥", "\\perp");
        SYMBOLS.put("∥", "\\parallel");
        SYMBOLS.put("…", "\\ldots");
        SYMBOLS.put("⋯", "\\cdots");
        SYMBOLS.put("∴", "\\therefore");
        SYMBOLS.put("∵", "\\because");
        SYMBOLS.put("°", "^\\circ");
        SYMBOLS.put("ⅆ", "\\, d");

        // large operators
        SYMBOLS.put("∑", "\\sum");
        SYMBOLS.put("∏", "\\prod");
        SYMBOLS.put("∐", "\\coprod");
        SYMBOLS.put("∫", "\\int");
        SYMBOLS.put("∬", "\\iint");
        SYMBOLS.put("∭", "\\iiint");
        SYMBOLS.put("∮", "\\oint");
        SYMBOLS.put("⋃", "\\bigcup");
        SYMBOLS.put("⋂", "\\bigcap");
        SYMBOLS.put("⋁", "\\bigvee");
        SYMBOLS.put("⋀", "\\bigwedge");
        SYMBOLS.put("⨁", "\\bigoplus");
        SYMBOLS.put("⨂", "\\bigotimes");

        // Greek
        SYMBOLS.put("α", "\\alpha");
        SYMBOLS.put("β", "\\beta");
        SYMBOLS.put("γ", "\\gamma");
        SYMBOLS.put("δ", "\\delta");
        SYMBOLS.put("ε", "\\epsilon");
        SYMBOLS.put("ϵ", "\\epsilon");
        SYMBOLS.put("ζ", "\\zeta");
        SYMBOLS.put("η", "\\eta");
        SYMBOLS.put("θ", "\\theta");
        SYMBOLS.put("ϑ", "\\vartheta");
        SYMBOLS.put("ι", "\\iota");
        SYMBOLS.put("κ", "\\kappa");
        SYMBOLS.put("λ", "\\lambda");
        SYMBOLS.put("μ", "\\mu");
        SYMBOLS.put("ν", "\\nu");
        SYMBOLS.put("ξ", "\\xi");
        SYMBOLS.put("π", "\\pi");
        SYMBOLS.put("ρ", "\\rho");
        SYMBOLS.put("σ", "\\sigma");
        SYMBOLS.put("ς", "\\varsigma");
        SYMBOLS.put("τ", "\\tau");
        SYMBOLS.put("υ", "\\upsilon");
        SYMBOLS.put("φ", "\\phi");
        SYMBOLS.put("ϕ", "\\phi");
        SYMBOLS.put("χ", "\\chi");
        SYMBOLS.put("ψ", "\\psi");
        SYMBOLS.put("ω", "\\omega");
        SYMBOLS.put("Γ", "\\Gamma");
        SYMBOLS.put("Δ", "\\Delta");
        SYMBOLS.put("Θ", "\\Theta");
        SYMBOLS.put("Λ", "\\Lambda");
        SYMBOLS.put("Ξ", "\\Xi");
        SYMBOLS.put("Π", "\\Pi");
        SYMBOLS.put("Σ", "\\Sigma");
        SYMBOLS.put("ϒ", "\\Upsilon");
        SYMBOLS.put("Υ", "\\Upsilon");
        SYMBOLS.put("Φ", "\\Phi");
        SYMBOLS.put("Ψ", "\\Psi");
        SYMBOLS.put("Ω", "\\Omega");

        List<String> glyphs = new ArrayList<>(SYMBOLS.keySet());
        glyphs.sort(Comparator.comparingInt(String::length).reversed());
        GLYPHS_LONGEST_FIRST = Collections.unmodifiableList(glyphs);
    }

    private SymbolTable() {}

    static String lookup(String glyph) {
        return SYMBOLS.get(glyph);
    }

    static boolean contains(String glyph) {
        return SYMBOLS.containsKey(glyph);
    }

    public static Map<String, String> entries() {
        return Collections.unmodifiableMap(SYMBOLS);
    }

    public static String substitute(String text) {
        if (text == null || text.isEmpty()) return "";

        StringBuilder result = new StringBuilder(text.length() + 16);
        int i = 0;
        while (i < text.length()) {
            String glyph = matchAt(text, i);
            if (glyph == null) {
                result.append(text.charAt(i));
                i++;
                continue;
            }

            String command = SYMBOLS.get(glyph);
            result.append(command);
            i += glyph.length();
            if (i < text.length() && Character.isLetter(text.charAt(i))
                    && ENDS_WITH_COMMAND.matcher(command).find()) {
                result.append(' ');
            }
        }
        return result.toString();
    }

    private static String matchAt(String text, int offset) {
        for (String glyph : GLYPHS_LONGEST_FIRST) {
            if (text.startsWith(glyph, offset)) {
                return glyph;
            }
        }
        return null;
    }
}
