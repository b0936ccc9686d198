package com.formula.format;

import java.util.Locale;

/**
 * Output modes offered by {@link FormulaProcessor}.
 */
public enum OutputMode {
    BEAUTIFY,
    MINIFY,
    HTML,
    JAVASCRIPT,
    CSHARP,
    PYTHON,

    /**
     * Rewrite Smartsheet {@code @row} references into a LET formula.
     */
    SMARTSHEET;

    public static OutputMode fromName(String name) {
        String normalized = name.trim().toUpperCase(Locale.ROOT).replace("-", "_");
        return switch (normalized) {
            case "JS" -> JAVASCRIPT;
            case "C#", "CS" -> CSHARP;
            default -> valueOf(normalized);
        };
    }
}
