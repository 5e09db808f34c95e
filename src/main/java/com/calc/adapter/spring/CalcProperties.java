package com.calc.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for Calc.
 */
@ConfigurationProperties(prefix = "calc")
public class CalcProperties {

    /**
     * Whether Calc is enabled.
     */
    private boolean enabled = true;

    /**
     * Path to the Calc configuration file.
     * Supports classpath: prefix for classpath resources. Blank means built-in defaults.
     */
    private String configPath = "classpath:calc.yaml";

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
