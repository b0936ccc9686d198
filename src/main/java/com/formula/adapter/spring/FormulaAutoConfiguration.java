package com.formula.adapter.spring;

import com.formula.config.TemplateConfigLoader;
import com.formula.config.TemplateRegistry;
import com.formula.format.FormulaProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot auto-configuration for the formula beautifier.
 */
@Configuration
@ConditionalOnProperty(prefix = "formula", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(FormulaProperties.class)
public class FormulaAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(FormulaAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public TemplateRegistry templateRegistry(FormulaProperties properties) {
        String path = properties.getTemplatesPath();
        if (path == null || path.isBlank()) {
            log.info("No template file configured, using built-in template sets");
            return TemplateRegistry.defaults(properties.getIndentWidth());
        }
        return TemplateConfigLoader.load(path, properties.getIndentWidth());
    }

    @Bean
    @ConditionalOnMissingBean
    public FormulaProcessor formulaProcessor(TemplateRegistry templateRegistry) {
        log.info("Creating FormulaProcessor with template sets: {}", templateRegistry.names());
        return new FormulaProcessor(templateRegistry);
    }
}
