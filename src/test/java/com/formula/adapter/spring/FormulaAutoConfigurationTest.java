package com.formula.adapter.spring;

import com.formula.config.FormulaConfig;
import com.formula.core.DefaultFormulaEngine;
import com.formula.core.FormulaEngine;
import com.formula.spring.EnableFormulaEngine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for FormulaAutoConfiguration.
 */
class FormulaAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(FormulaAutoConfiguration.class));

    @Test
    @DisplayName("Should create engine from bundled configuration")
    void shouldCreateDefaultEngine() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(FormulaEngine.class);
            assertThat(context.getBean(FormulaConfig.class)).isEqualTo(FormulaConfig.defaults());
            assertThat(context.getBean(FormulaEngine.class).parse("y ~ x").allGeneratedColumns())
                    .containsExactly("y", "intercept", "x");
        });
    }

    @Test
    @DisplayName("Should load configuration from configured path")
    void shouldUseConfigPath() {
        contextRunner
                .withPropertyValues("formula.config-path=classpath:formula-test.yaml")
                .run(context -> {
                    assertThat(context.getBean(FormulaConfig.class).name()).isEqualTo("test-engine");
                    DefaultFormulaEngine engine = (DefaultFormulaEngine) context.getBean(FormulaEngine.class);
                    assertThat(engine.getConfig().maxFormulaLength()).isEqualTo(128);
                });
    }

    @Test
    @DisplayName("Should back off when disabled")
    void shouldBackOffWhenDisabled() {
        contextRunner
                .withPropertyValues("formula.enabled=false")
                .run(context -> assertThat(context).doesNotHaveBean(FormulaEngine.class));
    }

    @Test
    @DisplayName("Should keep user-defined engine")
    void shouldKeepUserEngine() {
        contextRunner
                .withUserConfiguration(CustomEngineConfiguration.class)
                .run(context -> {
                    assertThat(context).hasSingleBean(FormulaEngine.class);
                    assertThat(context.getBean(FormulaEngine.class))
                            .isSameAs(context.getBean(CustomEngineConfiguration.class).engine);
                });
    }

    @Test
    @DisplayName("Should fail startup on missing configuration file")
    void shouldFailOnMissingConfig() {
        contextRunner
                .withPropertyValues("formula.config-path=classpath:missing.yaml")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    @DisplayName("@EnableFormulaEngine should import the configuration")
    void shouldImportWithAnnotation() {
        new ApplicationContextRunner()
                .withUserConfiguration(EnabledApplication.class)
                .run(context -> assertThat(context).hasSingleBean(FormulaEngine.class));
    }

    @Configuration(proxyBeanMethods = false)
    static class CustomEngineConfiguration {

        final FormulaEngine engine = new DefaultFormulaEngine(new FormulaConfig("custom", 100, false));

        @Bean
        FormulaEngine customEngine() {
            return engine;
        }
    }

    @Configuration(proxyBeanMethods = false)
    @EnableFormulaEngine
    static class EnabledApplication {
    }
}
