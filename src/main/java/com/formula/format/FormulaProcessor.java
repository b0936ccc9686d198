package com.formula.format;

import com.formula.config.TemplateRegistry;
import com.formula.render.TemplateConfig;
import com.formula.smartsheet.LocationMapping;
import com.formula.smartsheet.MappingCsvParser;
import com.formula.smartsheet.MappingJsonParser;
import com.formula.smartsheet.SmartsheetConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Dispatches formula requests to the emitters and the Smartsheet converter.
 * Failures propagate as {@link com.formula.exception.FormulaException} subclasses.
 */
public class FormulaProcessor {

    private static final Logger log = LoggerFactory.getLogger(FormulaProcessor.class);

    private final TemplateRegistry templateRegistry;

    public FormulaProcessor(TemplateRegistry templateRegistry) {
        this.templateRegistry = templateRegistry;
    }

    public String process(FormulaRequest request) {
        log.debug("Processing formula: mode={}, eu={}, template={}",
                request.mode(), request.euSeparators(), request.templateName());

        if (request.templateName() != null) {
            TemplateConfig config = templateRegistry.get(request.templateName());
            return FormulaFormatter.format(request.formula(), config, request.euSeparators());
        }

        String formula = request.formula();
        boolean eu = request.euSeparators();

        return switch (request.mode()) {
            case BEAUTIFY -> FormulaFormatter.beautify(formula, request.indentWidth(), eu);
            case MINIFY -> FormulaFormatter.minify(formula, eu);
            case HTML -> FormulaFormatter.toHtml(formula, request.indentWidth(), eu);
            case JAVASCRIPT -> FormulaFormatter.toTargetLanguage(formula, TargetLanguage.JAVASCRIPT, eu);
            case CSHARP -> FormulaFormatter.toTargetLanguage(formula, TargetLanguage.CSHARP, eu);
            case PYTHON -> FormulaFormatter.toTargetLanguage(formula, TargetLanguage.PYTHON, eu);
            case SMARTSHEET -> convertSmartsheet(request);
        };
    }

    private String convertSmartsheet(FormulaRequest request) {
        List<LocationMapping> mappings = request.mappingFormat() == MappingFormat.CSV
                ? MappingCsvParser.parse(request.mappings())
                : MappingJsonParser.parse(request.mappings());
        log.debug("Parsed {} location mappings", mappings.size());

        String converted = SmartsheetConverter.convert(request.formula(), mappings);
        boolean eu = request.euSeparators();

        return switch (request.smartsheetFormat()) {
            case BEAUTIFY -> FormulaFormatter.format(converted,
                    TemplatePresets.beautify(request.indentWidth()).toBuilder().prefix("").build(), eu);
            case MINIFY -> FormulaFormatter.format(converted,
                    TemplatePresets.minify().toBuilder().prefix("").build(), eu);
            case RAW -> converted;
        };
    }

    public TemplateRegistry getTemplateRegistry() {
        return templateRegistry;
    }
}
