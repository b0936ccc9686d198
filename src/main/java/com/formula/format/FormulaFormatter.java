package com.formula.format;

import com.formula.expression.FormulaTokenizer;
import com.formula.expression.TokenStream;
import com.formula.render.FormulaRenderer;
import com.formula.render.TemplateConfig;

/**
 * Facade for tokenizing formulas and rendering them through the built-in template sets.
 * <p>
 * Supports:
 * <ul>
 *   <li>Beautify: one argument per line, indented by scope depth</li>
 *   <li>Minify: no optional whitespace</li>
 *   <li>HTML: beautified and wrapped in styled spans</li>
 *   <li>Target languages: JavaScript, C# and Python expressions</li>
 * </ul>
 * The {@code useEu} flag selects ';' as the argument separator instead of ','.
 */
public final class FormulaFormatter {

    private FormulaFormatter() {
    }

    public static TokenStream tokenize(String formula, boolean useEu) {
        return FormulaTokenizer.tokenize(formula, useEu);
    }

    public static String render(TokenStream tokens, TemplateConfig config) {
        return FormulaRenderer.render(tokens, config);
    }

    /**
     * Tokenize and render a formula with a template set.
     */
    public static String format(String formula, TemplateConfig config, boolean useEu) {
        return render(tokenize(formula, useEu), config);
    }

    public static String beautify(String formula, int indentWidth, boolean useEu) {
        return format(formula, TemplatePresets.beautify(indentWidth), useEu);
    }

    public static String minify(String formula, boolean useEu) {
        return format(formula, TemplatePresets.minify(), useEu);
    }

    public static String toHtml(String formula, int indentWidth, boolean useEu) {
        return format(formula, TemplatePresets.html(indentWidth), useEu);
    }

    /**
     * Translate a formula to a JavaScript expression.
     */
    public static String toTargetLanguage(String formula, boolean useEu) {
        return toTargetLanguage(formula, TargetLanguage.JAVASCRIPT, useEu);
    }

    public static String toTargetLanguage(String formula, TargetLanguage language, boolean useEu) {
        return format(formula, TemplatePresets.targetLanguage(language), useEu);
    }
}
