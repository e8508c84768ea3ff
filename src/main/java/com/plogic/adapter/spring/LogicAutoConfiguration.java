package com.plogic.adapter.spring;

import com.plogic.PropositionEngine;
import com.plogic.config.ConfigLoader;
import com.plogic.config.LogicConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot auto-configuration for plogic.
 */
@Configuration
@ConditionalOnProperty(prefix = "plogic", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(LogicProperties.class)
public class LogicAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(LogicAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public LogicConfig logicConfig(LogicProperties properties) {
        log.info("Loading plogic configuration from: {}", properties.getConfigPath());
        return ConfigLoader.load(properties.getConfigPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public PropositionEngine propositionEngine(LogicConfig config) {
        log.info("Creating PropositionEngine: max-depth {}, style {}", config.maxDepth(), config.defaultStyle());
        return new PropositionEngine(config);
    }
}
