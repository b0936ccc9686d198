package com.formula.format;

import java.util.Objects;

/**
 * A formula processing request.
 *
 * @param formula          Formula text
 * @param mode             Output mode
 * @param euSeparators     true for ';' argument separators
 * @param indentWidth      Spaces per indent level for beautify and HTML output
 * @param templateName     Named template set from the registry; overrides {@code mode} when set
 * @param mappings         Location mapping table for Smartsheet conversion (may be null)
 * @param mappingFormat    Encoding of {@code mappings}
 * @param smartsheetFormat Layout of the converted Smartsheet formula
 */
public record FormulaRequest(
        String formula,
        OutputMode mode,
        boolean euSeparators,
        int indentWidth,
        String templateName,
        String mappings,
        MappingFormat mappingFormat,
        SmartsheetFormat smartsheetFormat
) {
    public FormulaRequest {
        Objects.requireNonNull(formula, "formula");
        Objects.requireNonNull(mode, "mode");
        if (mappingFormat == null) {
            mappingFormat = MappingFormat.JSON;
        }
        if (smartsheetFormat == null) {
            smartsheetFormat = SmartsheetFormat.BEAUTIFY;
        }
    }

    /**
     * Request with default layout settings (US separators, 4-space indent).
     */
    public static FormulaRequest of(String formula, OutputMode mode) {
        return new FormulaRequest(formula, mode, false, TemplatePresets.DEFAULT_INDENT_WIDTH,
                null, null, null, null);
    }

    /**
     * Smartsheet conversion request.
     */
    public static FormulaRequest smartsheet(String formula, String mappings, MappingFormat mappingFormat,
                                            SmartsheetFormat smartsheetFormat) {
        return new FormulaRequest(formula, OutputMode.SMARTSHEET, false, TemplatePresets.DEFAULT_INDENT_WIDTH,
                null, mappings, mappingFormat, smartsheetFormat);
    }
}
