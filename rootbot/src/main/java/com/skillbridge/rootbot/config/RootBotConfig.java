package com.skillbridge.rootbot.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Turns the bound {@code skillbridge.*} properties into the single
 * {@link RouterConfiguration} bean. Startup fails if the configuration is invalid.
 */
@Configuration
@EnableConfigurationProperties(RootBotProperties.class)
public class RootBotConfig {

    private static final Logger log = LoggerFactory.getLogger(RootBotConfig.class);

    @Bean
    RouterConfiguration routerConfiguration(RootBotProperties properties) {
        RouterConfiguration config = RouterConfiguration.from(properties);
        log.info("Skill host endpoint: {}", config.skillHostEndpoint());
        config.skills().values().forEach(s ->
                log.info("Registered skill '{}' at {}", s.id(), s.skillEndpoint()));
        log.info("Trigger keyword '{}' starts skill '{}'", config.triggerKeyword(), config.targetSkillId());
        return config;
    }
}
