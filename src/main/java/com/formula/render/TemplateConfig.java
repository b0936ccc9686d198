package com.formula.render;

import com.formula.exception.ConfigurationException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Template set driving {@link FormulaRenderer}.
 * <p>
 * Immutable; use {@link #builder()} or {@link #toBuilder()} to derive variants.
 */
public final class TemplateConfig {

    private final Map<RenderCase, Template> templates;
    private final String indentUnit;
    private final String newLine;
    private final String prefix;
    private final String postfix;
    private final TokenRewriter rewriter;

    private TemplateConfig(Builder builder) {
        this.templates = Collections.unmodifiableMap(new EnumMap<>(builder.templates));
        this.indentUnit = builder.indentUnit;
        this.newLine = builder.newLine;
        this.prefix = builder.prefix;
        this.postfix = builder.postfix;
        this.rewriter = builder.rewriter;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.templates.putAll(templates);
        builder.indentUnit = indentUnit;
        builder.newLine = newLine;
        builder.prefix = prefix;
        builder.postfix = postfix;
        builder.rewriter = rewriter;
        return builder;
    }

    public Optional<Template> template(RenderCase renderCase) {
        return Optional.ofNullable(templates.get(renderCase));
    }

    /**
     * Template for a render case.
     *
     * @throws ConfigurationException if the case has no template
     */
    public Template requireTemplate(RenderCase renderCase) {
        Template template = templates.get(renderCase);
        if (template == null) {
            throw new ConfigurationException("No template configured for '" + renderCase.key() + "'");
        }
        return template;
    }

    public Map<RenderCase, Template> templates() {
        return templates;
    }

    public String indentUnit() {
        return indentUnit;
    }

    public String newLine() {
        return newLine;
    }

    public String prefix() {
        return prefix;
    }

    public String postfix() {
        return postfix;
    }

    public Optional<TokenRewriter> rewriter() {
        return Optional.ofNullable(rewriter);
    }

    public static final class Builder {
        private final Map<RenderCase, Template> templates = new EnumMap<>(RenderCase.class);
        private String indentUnit = "";
        private String newLine = "";
        private String prefix = "";
        private String postfix = "";
        private TokenRewriter rewriter;

        private Builder() {
        }

        public Builder template(RenderCase renderCase, String source) {
            templates.put(Objects.requireNonNull(renderCase, "renderCase"), Template.parse(source));
            return this;
        }

        public Builder withoutTemplate(RenderCase renderCase) {
            templates.remove(renderCase);
            return this;
        }

        public Builder indentUnit(String indentUnit) {
            this.indentUnit = Objects.requireNonNull(indentUnit, "indentUnit");
            return this;
        }

        public Builder newLine(String newLine) {
            this.newLine = Objects.requireNonNull(newLine, "newLine");
            return this;
        }

        public Builder prefix(String prefix) {
            this.prefix = Objects.requireNonNull(prefix, "prefix");
            return this;
        }

        public Builder postfix(String postfix) {
            this.postfix = Objects.requireNonNull(postfix, "postfix");
            return this;
        }

        /**
         * Set the per-token hook, or null for none.
         */
        public Builder rewriter(TokenRewriter rewriter) {
            this.rewriter = rewriter;
            return this;
        }

        public TemplateConfig build() {
            return new TemplateConfig(this);
        }
    }
}
