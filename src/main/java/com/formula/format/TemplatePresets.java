package com.formula.format;

import com.formula.render.RenderCase;
import com.formula.render.TemplateConfig;

/**
 * Built-in template sets.
 */
public final class TemplatePresets {

    public static final int DEFAULT_INDENT_WIDTH = 4;

    private TemplatePresets() {
    }

    /**
     * Multi-line layout: one argument per line, nested scopes indented.
     *
     * @param indentWidth Spaces per indent level
     */
    public static TemplateConfig beautify(int indentWidth) {
        return TemplateConfig.builder()
                .template(RenderCase.FUNCTION_START, "{{autoindent}}{{token}}(\n")
                .template(RenderCase.FUNCTION_STOP, "\n{{autoindent}})")
                .template(RenderCase.OPERAND_TEXT, "{{autoindent}}\"{{token}}\"")
                .template(RenderCase.OPERAND_NUMBER, "{{autoindent}}{{token}}")
                .template(RenderCase.OPERAND_LOGICAL, "{{autoindent}}{{token}}")
                .template(RenderCase.OPERAND_RANGE, "{{autoindent}}{{token}}")
                .template(RenderCase.OPERAND_ERROR, "{{autoindent}}{{token}}")
                .template(RenderCase.ARGUMENT, "{{token}}\n")
                .template(RenderCase.OPERATOR_INFIX, " {{token}} ")
                .template(RenderCase.SUBEXPRESSION_START, "{{autoindent}}(\n")
                .template(RenderCase.SUBEXPRESSION_STOP, "\n{{autoindent}})")
                .indentUnit(indent(indentWidth))
                .newLine("\n")
                .prefix("=")
                .rewriter(SpreadsheetTextRewriter.INSTANCE)
                .build();
    }

    /**
     * Single-line layout without optional whitespace.
     */
    public static TemplateConfig minify() {
        return TemplateConfig.builder()
                .template(RenderCase.FUNCTION_START, "{{token}}(")
                .template(RenderCase.FUNCTION_STOP, ")")
                .template(RenderCase.OPERAND_TEXT, "\"{{token}}\"")
                .template(RenderCase.OPERAND_NUMBER, "{{token}}")
                .template(RenderCase.OPERAND_LOGICAL, "{{token}}")
                .template(RenderCase.OPERAND_RANGE, "{{token}}")
                .template(RenderCase.OPERAND_ERROR, "{{token}}")
                .template(RenderCase.ARGUMENT, "{{token}}")
                .template(RenderCase.OPERATOR_INFIX, "{{token}}")
                .template(RenderCase.SUBEXPRESSION_START, "(")
                .template(RenderCase.SUBEXPRESSION_STOP, ")")
                .prefix("=")
                .rewriter(SpreadsheetTextRewriter.INSTANCE)
                .build();
    }

    /**
     * Beautify layout with each token category wrapped in a styled span.
     *
     * @param indentWidth Spaces per indent level
     */
    public static TemplateConfig html(int indentWidth) {
        return TemplateConfig.builder()
                .template(RenderCase.FUNCTION_START,
                        "<span class=\"function\">{{autoindent}}<span class=\"function-name\">{{token}}</span>(\n")
                .template(RenderCase.FUNCTION_STOP, "\n{{autoindent}})</span>")
                .template(RenderCase.OPERAND_TEXT, "{{autoindent}}<span class=\"text\">\"{{token}}\"</span>")
                .template(RenderCase.OPERAND_NUMBER, "{{autoindent}}<span class=\"number\">{{token}}</span>")
                .template(RenderCase.OPERAND_LOGICAL, "{{autoindent}}<span class=\"logical\">{{token}}</span>")
                .template(RenderCase.OPERAND_RANGE, "{{autoindent}}<span class=\"range\">{{token}}</span>")
                .template(RenderCase.OPERAND_ERROR, "{{autoindent}}<span class=\"error\">{{token}}</span>")
                .template(RenderCase.ARGUMENT, "{{token}}\n")
                .template(RenderCase.OPERATOR_INFIX, " <span class=\"operator\">{{token}}</span>{{autolinebreak}} ")
                .template(RenderCase.SUBEXPRESSION_START, "{{autoindent}}<span class=\"subexpression\">(\n")
                .template(RenderCase.SUBEXPRESSION_STOP, "\n{{autoindent}})</span>")
                .indentUnit(indent(indentWidth))
                .newLine("\n")
                .prefix("<span class=\"equals\">=</span>")
                .rewriter(HtmlRewriter.INSTANCE)
                .build();
    }

    /**
     * Minified shape with operators and literals translated to a target language.
     */
    public static TemplateConfig targetLanguage(TargetLanguage language) {
        return minify().toBuilder()
                .template(RenderCase.ARGUMENT, ", ")
                .template(RenderCase.OPERATOR_INFIX, " {{token}} ")
                .prefix("")
                .rewriter(CrossLanguageRewriter.forLanguage(language))
                .build();
    }

    private static String indent(int width) {
        if (width < 0) {
            throw new IllegalArgumentException("Indent width must not be negative: " + width);
        }
        return " ".repeat(width);
    }
}
