package com.formula.format;

/**
 * Layout applied to a converted Smartsheet formula.
 */
public enum SmartsheetFormat {
    BEAUTIFY,
    MINIFY,
    RAW
}
