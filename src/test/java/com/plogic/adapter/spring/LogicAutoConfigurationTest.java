package com.plogic.adapter.spring;

import com.plogic.PropositionEngine;
import com.plogic.config.LogicConfig;
import com.plogic.exception.ConfigurationException;
import com.plogic.format.FormatStyle;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for LogicAutoConfiguration.
 */
class LogicAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(LogicAutoConfiguration.class));

    @Test
    @DisplayName("Should create an engine from the configured file")
    void shouldCreateEngine() {
        contextRunner
                .withPropertyValues("plogic.config-path=classpath:plogic-test.yaml")
                .run(context -> {
                    assertNull(context.getStartupFailure());
                    PropositionEngine engine = context.getBean(PropositionEngine.class);
                    assertEquals(new LogicConfig(64, FormatStyle.FORMAL), engine.getConfig());
                    assertEquals("(P & Q)", engine.format(engine.parse("P & Q")));
                });
    }

    @Test
    @DisplayName("Should use the bundled configuration by default")
    void shouldUseBundledConfiguration() {
        contextRunner.run(context ->
                assertEquals(LogicConfig.defaults(), context.getBean(LogicConfig.class)));
    }

    @Test
    @DisplayName("Should back off when disabled")
    void shouldBackOffWhenDisabled() {
        contextRunner
                .withPropertyValues("plogic.enabled=false")
                .run(context -> assertTrue(context.getBeansOfType(PropositionEngine.class).isEmpty()));
    }

    @Test
    @DisplayName("Should keep a user-defined configuration")
    void shouldKeepUserConfig() {
        contextRunner
                .withBean(LogicConfig.class, () -> new LogicConfig(16, FormatStyle.CANONICAL))
                .run(context ->
                        assertEquals(16, context.getBean(PropositionEngine.class).getConfig().maxDepth()));
    }

    @Test
    @DisplayName("Should fail startup on a missing configuration file")
    void shouldFailOnMissingFile() {
        contextRunner
                .withPropertyValues("plogic.config-path=classpath:missing.yaml")
                .run(context -> {
                    Throwable failure = context.getStartupFailure();
                    assertNotNull(failure);
                    Throwable cause = failure;
                    while (cause != null && !(cause instanceof ConfigurationException)) {
                        cause = cause.getCause();
                    }
                    assertNotNull(cause, "expected a ConfigurationException in the cause chain");
                });
    }

    @Test
    @DisplayName("Should bind plogic properties")
    void shouldBindProperties() {
        LogicProperties properties = new LogicProperties();
        assertTrue(properties.isEnabled());
        assertEquals("classpath:plogic.yaml", properties.getConfigPath());

        LogicAutoConfiguration configuration = new LogicAutoConfiguration();
        properties.setConfigPath("classpath:plogic-test.yaml");
        LogicConfig config = configuration.logicConfig(properties);
        assertEquals(64, configuration.propositionEngine(config).getConfig().maxDepth());
    }
}
