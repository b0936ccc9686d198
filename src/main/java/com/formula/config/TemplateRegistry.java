package com.formula.config;

import com.formula.exception.ConfigurationException;
import com.formula.format.TargetLanguage;
import com.formula.format.TemplatePresets;
import com.formula.render.TemplateConfig;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Named template sets: the built-in presets plus any loaded from configuration.
 */
public final class TemplateRegistry {

    public static final String BEAUTIFY = "beautify";
    public static final String MINIFY = "minify";
    public static final String HTML = "html";

    private final Map<String, TemplateConfig> templates;

    private TemplateRegistry(Map<String, TemplateConfig> templates) {
        this.templates = Collections.unmodifiableMap(new LinkedHashMap<>(templates));
    }

    /**
     * Registry holding only the built-in presets.
     *
     * @param indentWidth Indent width for the beautify and HTML presets
     */
    public static TemplateRegistry defaults(int indentWidth) {
        return new TemplateRegistry(builtIns(indentWidth));
    }

    static TemplateRegistry of(Map<String, TemplateConfig> templates) {
        return new TemplateRegistry(templates);
    }

    static Map<String, TemplateConfig> builtIns(int indentWidth) {
        Map<String, TemplateConfig> builtIns = new LinkedHashMap<>();
        builtIns.put(BEAUTIFY, TemplatePresets.beautify(indentWidth));
        builtIns.put(MINIFY, TemplatePresets.minify());
        builtIns.put(HTML, TemplatePresets.html(indentWidth));
        for (TargetLanguage language : TargetLanguage.values()) {
            builtIns.put(language.name().toLowerCase(Locale.ROOT), TemplatePresets.targetLanguage(language));
        }
        return builtIns;
    }

    /**
     * Template set by name.
     *
     * @throws ConfigurationException if no set has this name
     */
    public TemplateConfig get(String name) {
        TemplateConfig config = templates.get(name);
        if (config == null) {
            throw new ConfigurationException("Unknown template set '" + name + "'. Available: " + templates.keySet());
        }
        return config;
    }

    public boolean contains(String name) {
        return templates.containsKey(name);
    }

    public Set<String> names() {
        return templates.keySet();
    }
}
