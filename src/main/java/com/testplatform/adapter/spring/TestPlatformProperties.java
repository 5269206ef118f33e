package com.testplatform.adapter.spring;

import com.testplatform.core.RunnerOptions;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Spring Boot configuration properties for the test platform.
 */
@ConfigurationProperties(prefix = "testplatform")
public class TestPlatformProperties {

    /**
     * Whether the test platform beans are created.
     */
    private boolean enabled = true;

    /**
     * Path to the runner options file.
     * Supports classpath: prefix for classpath resources.
     */
    private String configPath = "classpath:testplatform.yaml";

    /**
     * Overrides the options file's wait for a run request before cancel or abort gives up.
     */
    private Duration runRequestWaitTimeout;

    /**
     * Overrides the options file's design mode flag.
     */
    private Boolean designMode;

    /**
     * Overrides the options file's telemetry opt-in.
     */
    private Boolean telemetryOptedIn;

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

    public Duration getRunRequestWaitTimeout() {
        return runRequestWaitTimeout;
    }

    public void setRunRequestWaitTimeout(Duration runRequestWaitTimeout) {
        this.runRequestWaitTimeout = runRequestWaitTimeout;
    }

    public Boolean getDesignMode() {
        return designMode;
    }

    public void setDesignMode(Boolean designMode) {
        this.designMode = designMode;
    }

    public Boolean getTelemetryOptedIn() {
        return telemetryOptedIn;
    }

    public void setTelemetryOptedIn(Boolean telemetryOptedIn) {
        this.telemetryOptedIn = telemetryOptedIn;
    }

    /**
     * Apply the overrides that are set to options loaded from {@link #getConfigPath()}.
     */
    public RunnerOptions applyTo(RunnerOptions options) {
        if (runRequestWaitTimeout != null) {
            options.setRunRequestWaitTimeout(runRequestWaitTimeout);
        }
        if (designMode != null) {
            options.setDesignMode(designMode);
        }
        if (telemetryOptedIn != null) {
            options.setTelemetryOptedIn(telemetryOptedIn);
        }
        return options;
    }
}
