package com.formula.config;

import com.formula.exception.ConfigurationException;
import com.formula.render.RenderCase;
import com.formula.render.TemplateConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Loads custom template sets from YAML files.
 * <p>
 * Example:
 * <pre>
 * templates:
 *   compact:
 *     extends: beautify
 *     indent-width: 2
 *     argument: "{{token}} "
 *     prefix: ""
 * </pre>
 * Each set starts from a built-in preset ({@code extends}, default {@code beautify})
 * and overrides render case templates by key, plus {@code indent}, {@code newline},
 * {@code prefix} and {@code postfix}.
 */
public class TemplateConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(TemplateConfigLoader.class);

    private static final String EXTENDS = "extends";
    private static final String INDENT_WIDTH = "indent-width";
    private static final String INDENT = "indent";
    private static final String NEWLINE = "newline";
    private static final String PREFIX = "prefix";
    private static final String POSTFIX = "postfix";

    /**
     * Load template sets from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path        Path to the YAML file
     * @param indentWidth Default indent width for the built-in presets
     * @return Registry with the built-in presets and the loaded sets
     */
    public static TemplateRegistry load(String path, int indentWidth) {
        log.info("Loading template sets from: {}", path);

        try {
            Resource resource = getResource(path);
            try (InputStream inputStream = resource.getInputStream()) {
                return parseYaml(inputStream, indentWidth);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load template sets from: " + path, e);
        }
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    @SuppressWarnings("unchecked")
    static TemplateRegistry parseYaml(InputStream inputStream, int indentWidth) {
        Yaml yaml = new Yaml();
        Map<String, Object> root = yaml.load(inputStream);

        Map<String, TemplateConfig> templates = TemplateRegistry.builtIns(indentWidth);
        if (root == null) {
            log.warn("Template file is empty, using built-in template sets only");
            return TemplateRegistry.of(templates);
        }

        Object section = root.containsKey("templates") ? root.get("templates") : root;
        if (!(section instanceof Map<?, ?>)) {
            throw new ConfigurationException("'templates' must be a map of template set names to settings");
        }

        Map<String, TemplateConfig> loaded = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : ((Map<String, Object>) section).entrySet()) {
            String name = entry.getKey();
            if (!(entry.getValue() instanceof Map<?, ?> settings)) {
                throw new ConfigurationException("Template set '" + name + "' must be a map");
            }
            if (templates.containsKey(name)) {
                log.warn("Template set '{}' replaces a built-in set", name);
            }
            loaded.put(name, parseTemplateSet(name, (Map<String, Object>) settings, indentWidth));
        }
        templates.putAll(loaded);

        log.info("Loaded {} template sets: {}", loaded.size(), loaded.keySet());
        return TemplateRegistry.of(templates);
    }

    private static TemplateConfig parseTemplateSet(String name, Map<String, Object> settings, int indentWidth) {
        String base = getString(settings, EXTENDS, TemplateRegistry.BEAUTIFY);
        int width = getInt(settings, INDENT_WIDTH, indentWidth);

        Map<String, TemplateConfig> builtIns = TemplateRegistry.builtIns(width);
        TemplateConfig baseConfig = builtIns.get(base);
        if (baseConfig == null) {
            throw new ConfigurationException("Template set '" + name + "' extends unknown set '"
                    + base + "'. Available: " + builtIns.keySet());
        }

        TemplateConfig.Builder builder = baseConfig.toBuilder();
        for (Map.Entry<String, Object> entry : settings.entrySet()) {
            String key = entry.getKey();
            String value = entry.getValue() == null ? "" : entry.getValue().toString();

            switch (key) {
                case EXTENDS, INDENT_WIDTH -> {
                    // applied above
                }
                case INDENT -> builder.indentUnit(value);
                case NEWLINE -> builder.newLine(value);
                case PREFIX -> builder.prefix(value);
                case POSTFIX -> builder.postfix(value);
                default -> {
                    Optional<RenderCase> renderCase = RenderCase.fromKey(key);
                    if (renderCase.isPresent()) {
                        builder.template(renderCase.get(), value);
                    } else {
                        log.warn("Ignoring unknown key '{}' in template set '{}'", key, name);
                    }
                }
            }
        }

        log.debug("Parsed template set: name={}, extends={}, indentWidth={}", name, base, width);
        return builder.build();
    }

    // Helper methods

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).intValue();
        try {
            return Integer.parseInt(value.toString());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("'" + key + "' must be an integer, got '" + value + "'", e);
        }
    }
}
