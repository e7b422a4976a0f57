// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package verdant.syntax;

import java.util.LinkedHashMap;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The table of named entities, such as {@code \alpha} or {@code \nbsp}, recognized by the parser.
 */
public final class Entities {
    private Entities() {
    }

    /**
     * Returns the definition of the entity with the given name, or {@code null} if there's no such entity. Names are
     * case-sensitive: {@code \Delta} and {@code \delta} are different entities.
     */
    public static @Nullable Definition lookup(final String name) {
        return TABLE.get(name);
    }

    /**
     * The replacements of an entity in the supported output formats.
     *
     * @param name  the name, without the backslash
     * @param latex the LaTeX replacement
     * @param html  the HTML replacement, usually a character reference
     * @param utf8  the replacement as plain Unicode text
     */
    public record Definition(String name, String latex, String html, String utf8) {
    }

    private static void define(final String name, final String latex, final String html, final String utf8) {
        TABLE.put(name, new Definition(name, latex, html, utf8));
    }

    // Entities whose HTML form is the character reference of the same name.
    private static void named(final String name, final String latex, final String utf8) {
        define(name, latex, "&" + name + ";", utf8);
    }

    private static final Map<String, Definition> TABLE = new LinkedHashMap<>();

    static {
        // Greek letters.
        named("alpha", "\\alpha", "α");
        named("beta", "\\beta", "β");
        named("gamma", "\\gamma", "γ");
        named("delta", "\\delta", "δ");
        named("epsilon", "\\epsilon", "ε");
        named("zeta", "\\zeta", "ζ");
        named("eta", "\\eta", "η");
        named("theta", "\\theta", "θ");
        named("iota", "\\iota", "ι");
        named("kappa", "\\kappa", "κ");
        named("lambda", "\\lambda", "λ");
        named("mu", "\\mu", "μ");
        named("nu", "\\nu", "ν");
        named("xi", "\\xi", "ξ");
        named("omicron", "\\textit{o}", "ο");
        named("pi", "\\pi", "π");
        named("rho", "\\rho", "ρ");
        named("sigma", "\\sigma", "σ");
        named("sigmaf", "\\varsigma", "ς");
        named("tau", "\\tau", "τ");
        named("upsilon", "\\upsilon", "υ");
        named("phi", "\\phi", "φ");
        named("chi", "\\chi", "χ");
        named("psi", "\\psi", "ψ");
        named("omega", "\\omega", "ω");
        named("Alpha", "A", "Α");
        named("Beta", "B", "Β");
        named("Gamma", "\\Gamma", "Γ");
        named("Delta", "\\Delta", "Δ");
        named("Epsilon", "E", "Ε");
        named("Zeta", "Z", "Ζ");
        named("Eta", "H", "Η");
        named("Theta", "\\Theta", "Θ");
        named("Iota", "I", "Ι");
        named("Kappa", "K", "Κ");
        named("Lambda", "\\Lambda", "Λ");
        named("Mu", "M", "Μ");
        named("Nu", "N", "Ν");
        named("Xi", "\\Xi", "Ξ");
        named("Omicron", "O", "Ο");
        named("Pi", "\\Pi", "Π");
        named("Rho", "P", "Ρ");
        named("Sigma", "\\Sigma", "Σ");
        named("Tau", "T", "Τ");
        named("Upsilon", "\\Upsilon", "Υ");
        named("Phi", "\\Phi", "Φ");
        named("Chi", "X", "Χ");
        named("Psi", "\\Psi", "Ψ");
        named("Omega", "\\Omega", "Ω");
        define("varepsilon", "\\varepsilon", "&epsilon;", "ε");
        define("vartheta", "\\vartheta", "&thetasym;", "ϑ");
        define("varphi", "\\varphi", "&phi;", "φ");

        // Letters with diacritics.
        named("Agrave", "\\`{A}", "À");
        named("agrave", "\\`{a}", "à");
        named("Aacute", "\\'{A}", "Á");
        named("aacute", "\\'{a}", "á");
        named("Auml", "\\\"{A}", "Ä");
        named("auml", "\\\"{a}", "ä");
        named("Ccedil", "\\c{C}", "Ç");
        named("ccedil", "\\c{c}", "ç");
        named("Egrave", "\\`{E}", "È");
        named("egrave", "\\`{e}", "è");
        named("Eacute", "\\'{E}", "É");
        named("eacute", "\\'{e}", "é");
        named("Ntilde", "\\~{N}", "Ñ");
        named("ntilde", "\\~{n}", "ñ");
        named("Ouml", "\\\"{O}", "Ö");
        named("ouml", "\\\"{o}", "ö");
        named("Uuml", "\\\"{U}", "Ü");
        named("uuml", "\\\"{u}", "ü");
        named("szlig", "\\ss{}", "ß");
        named("aring", "\\aa{}", "å");
        named("Aring", "\\AA{}", "Å");
        named("oslash", "\\o{}", "ø");
        named("Oslash", "\\O{}", "Ø");
        named("aelig", "\\ae{}", "æ");
        named("AElig", "\\AE{}", "Æ");

        // Spaces and dashes.
        define("nbsp", "~", "&nbsp;", "\u00a0");
        named("ensp", "\\hspace*{.5em}", "\u2002");
        named("emsp", "\\hspace*{1em}", "\u2003");
        named("thinsp", "\\hspace*{.2em}", "\u2009");
        named("shy", "\\-", "\u00ad");
        named("ndash", "--", "\u2013");
        named("mdash", "---", "\u2014");

        // Punctuation and typography.
        named("hellip", "\\dots{}", "…");
        define("dots", "\\dots{}", "&hellip;", "…");
        named("laquo", "\\guillemotleft{}", "«");
        named("raquo", "\\guillemotright{}", "»");
        named("lsquo", "\\textquoteleft{}", "‘");
        named("rsquo", "\\textquoteright{}", "’");
        named("ldquo", "\\textquotedblleft{}", "“");
        named("rdquo", "\\textquotedblright{}", "”");
        named("bull", "\\textbullet{}", "•");
        named("middot", "\\textperiodcentered{}", "·");
        named("sect", "\\S", "§");
        named("para", "\\P{}", "¶");
        named("dagger", "\\textdagger{}", "†");
        named("Dagger", "\\textdaggerdbl{}", "‡");
        named("copy", "\\textcopyright{}", "©");
        named("reg", "\\textregistered{}", "®");
        named("trade", "\\texttrademark{}", "™");
        named("iexcl", "!`", "¡");
        named("iquest", "?`", "¿");
        named("amp", "\\&", "&");
        named("lt", "\\textless{}", "<");
        named("gt", "\\textgreater{}", ">");
        named("quot", "\\textquotedbl{}", "\"");
        define("backslash", "\\textbackslash{}", "\\", "\\");
        define("checkmark", "\\checkmark", "&#10003;", "✓");

        // Currency.
        named("euro", "\\texteuro{}", "€");
        named("pound", "\\pounds{}", "£");
        named("yen", "\\textyen{}", "¥");
        named("cent", "\\textcent{}", "¢");

        // Mathematics.
        named("deg", "\\textdegree{}", "°");
        named("micro", "\\textmu{}", "µ");
        named("plusmn", "\\textpm{}", "±");
        define("pm", "\\textpm{}", "&plusmn;", "±");
        named("times", "\\texttimes{}", "×");
        named("divide", "\\textdiv{}", "÷");
        define("div", "\\textdiv{}", "&divide;", "÷");
        named("minus", "\\minus", "−");
        named("le", "\\le", "≤");
        define("leq", "\\le", "&le;", "≤");
        named("ge", "\\ge", "≥");
        define("geq", "\\ge", "&ge;", "≥");
        named("ne", "\\ne", "≠");
        define("neq", "\\ne", "&ne;", "≠");
        named("equiv", "\\equiv", "≡");
        define("approx", "\\approx", "&asymp;", "≈");
        named("infin", "\\infty", "∞");
        define("infty", "\\infty", "&infin;", "∞");
        named("sum", "\\sum", "∑");
        named("prod", "\\prod", "∏");
        named("radic", "\\sqrt{\\,}", "√");
        define("sqrt", "\\sqrt{\\,}", "&radic;", "√");
        named("part", "\\partial", "∂");
        define("partial", "\\partial", "&part;", "∂");
        named("nabla", "\\nabla", "∇");
        named("isin", "\\in", "∈");
        define("in", "\\in", "&isin;", "∈");
        named("notin", "\\notin", "∉");
        named("forall", "\\forall", "∀");
        named("exist", "\\exists", "∃");
        define("exists", "\\exists", "&exist;", "∃");
        named("empty", "\\emptyset", "∅");
        named("cap", "\\cap", "∩");
        named("cup", "\\cup", "∪");
        named("sub", "\\subset", "⊂");
        named("sup", "\\supset", "⊃");
        named("and", "\\land", "∧");
        named("or", "\\lor", "∨");
        named("not", "\\textlnot{}", "¬");
        named("frac12", "\\textonehalf{}", "½");
        named("frac14", "\\textonequarter{}", "¼");
        named("frac34", "\\textthreequarters{}", "¾");

        // Arrows.
        named("larr", "\\leftarrow", "←");
        named("rarr", "\\rightarrow", "→");
        named("uarr", "\\uparrow", "↑");
        named("darr", "\\downarrow", "↓");
        named("harr", "\\leftrightarrow", "↔");
        named("lArr", "\\Leftarrow", "⇐");
        named("rArr", "\\Rightarrow", "⇒");
        named("hArr", "\\Leftrightarrow", "⇔");
        define("leftarrow", "\\leftarrow", "&larr;", "←");
        define("rightarrow", "\\rightarrow", "&rarr;", "→");
        define("to", "\\to", "&rarr;", "→");
        define("Leftarrow", "\\Leftarrow", "&lArr;", "⇐");
        define("Rightarrow", "\\Rightarrow", "&rArr;", "⇒");
    }
}
