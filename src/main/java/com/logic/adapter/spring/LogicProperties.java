package com.logic.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for the logic simplifier.
 */
@ConfigurationProperties(prefix = "logic")
public class LogicProperties {

    /**
     * Whether the simplifier beans are created.
     */
    private boolean enabled = true;

    /**
     * Path to the simplifier configuration file.
     * Supports classpath: prefix for classpath resources.
     */
    private String configPath = "classpath:logic-simplifier.yaml";

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getConfigPath() {
        return configPath;
    }

    public void setConfigPath(String configPath) {
        this.configPath = configPath;
    }
}
