package com.formula.adapter.cli;

import com.formula.adapter.spring.FormulaProperties;
import com.formula.format.FormulaRequest;
import com.formula.format.MappingFormat;
import com.formula.format.OutputMode;
import com.formula.format.SmartsheetFormat;
import org.springframework.boot.ApplicationArguments;

import java.util.List;
import java.util.Locale;

/**
 * Builds a {@link FormulaRequest} from command line arguments.
 * <p>
 * Options: {@code --mode}, {@code --eu}, {@code --indent}, {@code --template},
 * {@code --mappings}, {@code --mapping-format}, {@code --smartsheet-format}.
 * The non-option arguments, joined by spaces, are the formula.
 */
public final class FormulaCommandLine {

    public static final String USAGE = "Usage: formula [--mode=beautify|minify|html|javascript|csharp|python|smartsheet]"
            + " [--eu] [--indent=N] [--template=NAME] [--mappings=TEXT] [--mapping-format=json|csv]"
            + " [--smartsheet-format=beautify|minify|raw] FORMULA";

    private FormulaCommandLine() {
    }

    /**
     * Parse arguments, falling back to the configured properties.
     *
     * @throws IllegalArgumentException if the formula is missing or an option value is invalid
     */
    public static FormulaRequest parse(ApplicationArguments args, FormulaProperties properties) {
        List<String> formulaParts = args.getNonOptionArgs();
        if (formulaParts.isEmpty()) {
            throw new IllegalArgumentException("No formula given. " + USAGE);
        }
        String formula = String.join(" ", formulaParts);

        OutputMode mode = OutputMode.fromName(option(args, "mode", "beautify"));
        boolean eu = args.containsOption("eu") || properties.isEuSeparators();
        int indent = parseIndent(option(args, "indent", String.valueOf(properties.getIndentWidth())));
        String template = option(args, "template", null);
        String mappings = option(args, "mappings", null);
        MappingFormat mappingFormat = MappingFormat.valueOf(
                option(args, "mapping-format", "json").toUpperCase(Locale.ROOT));
        SmartsheetFormat smartsheetFormat = SmartsheetFormat.valueOf(
                option(args, "smartsheet-format", "beautify").toUpperCase(Locale.ROOT));

        return new FormulaRequest(formula, mode, eu, indent, template, mappings, mappingFormat, smartsheetFormat);
    }

    private static String option(ApplicationArguments args, String name, String defaultValue) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return defaultValue;
        }
        return values.get(values.size() - 1);
    }

    private static int parseIndent(String value) {
        try {
            int indent = Integer.parseInt(value.trim());
            if (indent < 0) {
                throw new IllegalArgumentException("--indent must not be negative: " + value);
            }
            return indent;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--indent must be an integer: " + value, e);
        }
    }
}
