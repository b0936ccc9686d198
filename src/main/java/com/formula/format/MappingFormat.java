package com.formula.format;

/**
 * Encoding of the location mapping table.
 */
public enum MappingFormat {
    JSON,
    CSV
}
