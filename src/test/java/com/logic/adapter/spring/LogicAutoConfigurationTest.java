package com.logic.adapter.spring;

import com.logic.LogicSimplifier;
import com.logic.config.SimplifierConfig;
import com.logic.exception.ConfigurationException;
import com.logic.parser.TokenizerMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for LogicAutoConfiguration wiring.
 */
class LogicAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(LogicAutoConfiguration.class);

    @Test
    @DisplayName("Creates a simplifier from the bundled configuration")
    void createsDefaultBeans() {
        contextRunner.run(context -> {
            assertNull(context.getStartupFailure());
            assertEquals(SimplifierConfig.defaults(), context.getBean(SimplifierConfig.class));

            LogicSimplifier simplifier = context.getBean(LogicSimplifier.class);
            assertEquals("B", simplifier.render(simplifier.simplify("(A or (not A)) and B")));
        });
    }

    @Test
    @DisplayName("Reads the configuration path from properties")
    void honoursConfigPath() {
        contextRunner
                .withPropertyValues("logic.config-path=classpath:test-simplifier.yaml")
                .run(context -> {
                    SimplifierConfig config = context.getBean(LogicSimplifier.class).getConfig();
                    assertEquals("test", config.name());
                    assertEquals(TokenizerMode.STRICT, config.tokenizerMode());
                });
    }

    @Test
    @DisplayName("Creates nothing when disabled")
    void disabled() {
        contextRunner
                .withPropertyValues("logic.enabled=false")
                .run(context -> assertTrue(context.getBeansOfType(LogicSimplifier.class).isEmpty()));
    }

    @Test
    @DisplayName("Backs off when the application defines its own configuration")
    void userConfigurationWins() {
        SimplifierConfig custom = SimplifierConfig.defaults().withMaxIterations(2);

        contextRunner
                .withBean(SimplifierConfig.class, () -> custom)
                .run(context -> assertEquals(2, context.getBean(LogicSimplifier.class).getConfig().maxIterations()));
    }

    @Test
    @DisplayName("Missing configuration file fails startup")
    void missingConfigurationFails() {
        contextRunner
                .withPropertyValues("logic.config-path=classpath:missing.yaml")
                .run(context -> {
                    Throwable failure = context.getStartupFailure();
                    assertNotNull(failure);
                    Throwable root = failure;
                    while (root.getCause() != null && !(root instanceof ConfigurationException)) {
                        root = root.getCause();
                    }
                    assertInstanceOf(ConfigurationException.class, root);
                });
    }
}
