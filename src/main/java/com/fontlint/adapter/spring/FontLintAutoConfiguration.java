package com.fontlint.adapter.spring;

import com.fontlint.config.RuleLoader;
import com.fontlint.engine.DefaultFontLintEngine;
import com.fontlint.engine.FontLintEngine;
import com.fontlint.selection.RuleList;
import com.fontlint.tag.TagCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot auto-configuration for font lint rule selection.
 */
@Configuration
@ConditionalOnProperty(prefix = "fontlint", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(FontLintProperties.class)
public class FontLintAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(FontLintAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public TagCatalog tagCatalog() {
        return TagCatalog.defaultCatalog();
    }

    @Bean
    @ConditionalOnMissingBean
    public RuleList ruleList(FontLintProperties properties, TagCatalog catalog) {
        log.debug("Rule paths: {}", properties.getRulesPaths());
        return RuleLoader.loadAll(properties.getRulesPaths(), catalog);
    }

    @Bean
    @ConditionalOnMissingBean
    public FontLintEngine fontLintEngine(RuleList rules) {
        return new DefaultFontLintEngine(rules);
    }
}
