package com.fontlint.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Spring Boot configuration properties for font lint rule selection.
 */
@ConfigurationProperties(prefix = "fontlint")
public class FontLintProperties {

    /**
     * Whether font lint rule selection is enabled.
     */
    private boolean enabled = true;

    /**
     * Rule files, applied in order.
     * Supports classpath: prefix for classpath resources.
     */
    private List<String> rulesPaths = new ArrayList<>(List.of("classpath:lint-rules.txt"));

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public List<String> getRulesPaths() {
        return rulesPaths;
    }

    public void setRulesPaths(List<String> rulesPaths) {
        this.rulesPaths = rulesPaths;
    }
}
