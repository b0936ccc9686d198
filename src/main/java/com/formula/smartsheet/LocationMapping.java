package com.formula.smartsheet;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Maps a Smartsheet column to a cell location.
 *
 * @param field    Column name as referenced by {@code [Field]@row}
 * @param location Cell reference bound in the LET header (e.g. "A2")
 * @param name     LET variable name; derived from {@code field} when blank
 * @param letName  LET header fragment ({@code name,location,}); derived when blank
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LocationMapping(
        @JsonProperty("field") String field,
        @JsonProperty("location") String location,
        @JsonProperty("name") String name,
        @JsonProperty("let_name") String letName
) {
    public static LocationMapping of(String field, String location) {
        return new LocationMapping(field, location, null, null).withDefaults();
    }

    /**
     * Fill in {@code name} and {@code letName} when they are missing.
     */
    public LocationMapping withDefaults() {
        String resolvedName = isBlank(name) ? FieldNames.fromField(field) : name;
        String resolvedLetName = isBlank(letName) ? resolvedName + "," + location + "," : letName;
        return new LocationMapping(field, location, resolvedName, resolvedLetName);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
