package com.logic.adapter.spring;

import com.logic.LogicSimplifier;
import com.logic.config.ConfigLoader;
import com.logic.config.SimplifierConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot auto-configuration for the logic simplifier.
 */
@Configuration
@ConditionalOnProperty(prefix = "logic", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(LogicProperties.class)
public class LogicAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(LogicAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public SimplifierConfig simplifierConfig(LogicProperties properties) {
        return ConfigLoader.load(properties.getConfigPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public LogicSimplifier logicSimplifier(SimplifierConfig config) {
        log.info("Creating LogicSimplifier: {}", config.name());
        return new LogicSimplifier(config);
    }
}
