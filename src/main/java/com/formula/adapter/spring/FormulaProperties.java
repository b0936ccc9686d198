package com.formula.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for the formula beautifier.
 */
@ConfigurationProperties(prefix = "formula")
public class FormulaProperties {

    /**
     * Whether the formula beans are enabled.
     */
    private boolean enabled = true;

    /**
     * Spaces per indent level for beautify and HTML output.
     */
    private int indentWidth = 4;

    /**
     * Use ';' as the argument separator.
     */
    private boolean euSeparators = false;

    /**
     * Path to a YAML file with custom template sets.
     * Supports classpath: prefix for classpath resources. Blank for built-in sets only.
     */
    private String templatesPath;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getIndentWidth() {
        return indentWidth;
    }

    public void setIndentWidth(int indentWidth) {
        this.indentWidth = indentWidth;
    }

    public boolean isEuSeparators() {
        return euSeparators;
    }

    public void setEuSeparators(boolean euSeparators) {
        this.euSeparators = euSeparators;
    }

    public String getTemplatesPath() {
        return templatesPath;
    }

    public void setTemplatesPath(String templatesPath) {
        this.templatesPath = templatesPath;
    }
}
