package com.formula.smartsheet;

import com.formula.exception.MappingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts a Smartsheet formula into a spreadsheet LET formula.
 * <p>
 * Every {@code [Field]@row} or {@code Field@row} reference is replaced by the mapped
 * variable name, lower-case {@code true}/{@code false} become {@code TRUE}/{@code FALSE},
 * and the result is wrapped as {@code LET(name,location,...\n<formula>\n)}.
 */
public final class SmartsheetConverter {

    private static final Logger log = LoggerFactory.getLogger(SmartsheetConverter.class);

    private static final Pattern LEADING_MARKERS = Pattern.compile("^[=']+");
    private static final Pattern ROW_REFERENCE = Pattern.compile("(\\[.+?\\]@row)|(\\w+@row)");
    private static final Pattern BRACKETED_FIELD = Pattern.compile("\\[(.+)\\]");
    private static final Pattern PLAIN_FIELD = Pattern.compile("(.+)@row");
    private static final Pattern TRUE_WORD = Pattern.compile("\\btrue\\b");
    private static final Pattern FALSE_WORD = Pattern.compile("\\bfalse\\b");

    private SmartsheetConverter() {
    }

    /**
     * Convert a formula.
     *
     * @param formula  Smartsheet formula
     * @param mappings Column to location mappings
     * @return LET formula without a leading '='
     * @throws MappingException if the formula has no {@code @row} reference or a reference is unmapped
     */
    public static String convert(String formula, List<LocationMapping> mappings) {
        String converted = LEADING_MARKERS.matcher(formula).replaceAll("");

        Set<String> references = new LinkedHashSet<>();
        Matcher matcher = ROW_REFERENCE.matcher(converted);
        while (matcher.find()) {
            references.add(matcher.group());
        }
        if (references.isEmpty()) {
            throw new MappingException("No @row column references found");
        }

        Map<String, LocationMapping> resolved = new LinkedHashMap<>();
        for (String reference : references) {
            String field = extractField(reference);
            LocationMapping mapping = mappings.stream()
                    .filter(candidate -> field.equals(candidate.field()))
                    .findFirst()
                    .orElseThrow(() -> new MappingException(
                            "No location mapping for field '" + field + "' referenced by " + reference));
            resolved.put(reference, mapping.withDefaults());
        }

        StringBuilder letNames = new StringBuilder();
        for (LocationMapping mapping : resolved.values()) {
            letNames.append(mapping.letName());
        }

        // Each match is replaced once, names inside longer references are left alone
        converted = ROW_REFERENCE.matcher(converted)
                .replaceAll(match -> Matcher.quoteReplacement(resolved.get(match.group()).name()));

        converted = TRUE_WORD.matcher(converted).replaceAll("TRUE");
        converted = FALSE_WORD.matcher(converted).replaceAll("FALSE");

        log.debug("Converted {} @row references into LET names", resolved.size());
        return "LET(" + letNames + "\n" + converted + "\n)";
    }

    private static String extractField(String reference) {
        Matcher bracketed = BRACKETED_FIELD.matcher(reference);
        if (bracketed.find()) {
            return bracketed.group(1);
        }
        Matcher plain = PLAIN_FIELD.matcher(reference);
        if (plain.find()) {
            return plain.group(1);
        }
        throw new MappingException("Unable to extract field from reference " + reference);
    }
}
