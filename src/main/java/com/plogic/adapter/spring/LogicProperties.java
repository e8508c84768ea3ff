package com.plogic.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot properties under {@code plogic.*}. They decide whether a
 * {@link com.plogic.PropositionEngine} bean is created and which YAML file supplies its
 * {@link com.plogic.config.LogicConfig}.
 */
@ConfigurationProperties(prefix = "plogic")
public class LogicProperties {

    /**
     * Set to false to skip the LogicConfig and PropositionEngine beans.
     */
    private boolean enabled = true;

    /**
     * YAML file holding {@code parser.max-depth} and {@code formatter.style}, read by
     * {@link com.plogic.config.ConfigLoader}. A {@code classpath:} prefix reads a classpath
     * resource; anything else is a file system path. Missing keys keep their defaults.
     */
    private String configPath = "classpath:plogic.yaml";

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
