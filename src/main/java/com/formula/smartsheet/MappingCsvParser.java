package com.formula.smartsheet;

import com.formula.exception.MappingException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Parses location mappings from CSV with a header row.
 * Required columns: {@code field}, {@code location}. Optional: {@code name}, {@code let_name}.
 * Cells may be double-quoted; {@code ""} inside quotes is a literal quote.
 */
public final class MappingCsvParser {

    private static final List<String> REQUIRED_HEADERS = List.of("field", "location");

    private MappingCsvParser() {
    }

    public static List<LocationMapping> parse(String csv) {
        if (csv == null || csv.isBlank()) {
            return List.of();
        }

        String[] lines = csv.strip().split("\r?\n");
        if (lines.length < 2) {
            throw new MappingException("CSV must have at least a header row and one data row");
        }

        List<String> headers = new ArrayList<>();
        for (String header : parseLine(lines[0])) {
            headers.add(header.toLowerCase(Locale.ROOT));
        }
        for (String required : REQUIRED_HEADERS) {
            if (!headers.contains(required)) {
                throw new MappingException("CSV must contain '" + required + "' column");
            }
        }

        List<LocationMapping> mappings = new ArrayList<>();
        for (int i = 1; i < lines.length; i++) {
            List<String> values = parseLine(lines[i]);
            if (values.size() != headers.size()) {
                throw new MappingException("Row " + (i + 1) + " has " + values.size()
                        + " columns, expected " + headers.size());
            }

            Map<String, String> row = new HashMap<>();
            for (int c = 0; c < headers.size(); c++) {
                row.put(headers.get(c), unquote(values.get(c)));
            }
            mappings.add(new LocationMapping(
                    row.get("field"),
                    row.get("location"),
                    row.get("name"),
                    row.get("let_name")
            ).withDefaults());
        }
        return mappings;
    }

    static List<String> parseLine(String line) {
        List<String> result = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inQuotes = false;
        int i = 0;

        while (i < line.length()) {
            char c = line.charAt(i);
            if (c == '"') {
                if (inQuotes && i + 1 < line.length() && line.charAt(i + 1) == '"') {
                    current.append('"');
                    i += 2;
                } else {
                    inQuotes = !inQuotes;
                    i++;
                }
            } else if (c == ',' && !inQuotes) {
                result.add(current.toString().strip());
                current.setLength(0);
                i++;
            } else {
                current.append(c);
                i++;
            }
        }

        result.add(current.toString().strip());
        return result;
    }

    private static String unquote(String value) {
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }
}
