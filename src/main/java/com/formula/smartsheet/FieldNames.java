package com.formula.smartsheet;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Derives LET variable names from Smartsheet column names.
 */
public final class FieldNames {

    private static final Pattern LEADING_DIGIT = Pattern.compile("^(\\d)");
    private static final Pattern TRAILING_HASH = Pattern.compile("#$");
    private static final Pattern INVALID_CHARS = Pattern.compile("[^a-zA-Z0-9 ]");

    private FieldNames() {
    }

    /**
     * Generate a variable name from a column name.
     * Example: "123 Field#" becomes "c123_field_num".
     */
    public static String fromField(String field) {
        String name = LEADING_DIGIT.matcher(field).replaceAll("c$1");
        name = TRAILING_HASH.matcher(name).replaceAll(" num");
        name = INVALID_CHARS.matcher(name).replaceAll("");
        return name.replace(' ', '_').toLowerCase(Locale.ROOT);
    }
}
