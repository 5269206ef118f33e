package com.testplatform.adapter.spring;

import com.testplatform.client.LoggingTestPlatformEventSource;
import com.testplatform.client.TestEngine;
import com.testplatform.client.TestPlatformEventSource;
import com.testplatform.config.OptionsLoader;
import com.testplatform.core.RunnerOptions;
import com.testplatform.core.TestRequestManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot auto-configuration for the test platform.
 * The request manager is only created when the application provides a {@link TestEngine}.
 */
@Configuration
@ConditionalOnProperty(prefix = "testplatform", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(TestPlatformProperties.class)
public class TestPlatformAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(TestPlatformAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public RunnerOptions runnerOptions(TestPlatformProperties properties) {
        RunnerOptions options = properties.applyTo(OptionsLoader.loadOrDefault(properties.getConfigPath()));
        log.info("Runner options: {}", options);
        return options;
    }

    @Bean
    @ConditionalOnMissingBean
    public TestPlatformEventSource testPlatformEventSource() {
        return new LoggingTestPlatformEventSource();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(TestEngine.class)
    public TestRequestManager testRequestManager(RunnerOptions runnerOptions,
                                                 TestEngine testEngine,
                                                 TestPlatformEventSource eventSource) {
        log.info("Creating TestRequestManager");
        return new TestRequestManager(runnerOptions, testEngine, eventSource);
    }
}
