package com.inkboard.selectionservice.config;

import com.inkboard.selectionservice.session.SelectionSessionManager;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring configuration for the selection engine.
 * Registers the SelectionSessionManager as a singleton bean; its maintenance
 * thread stops with the context.
 */
@Configuration
@EnableConfigurationProperties(SelectionProperties.class)
public class SelectionConfig {

    @Bean(destroyMethod = "shutdown")
    public SelectionSessionManager selectionSessionManager(SelectionProperties properties) {
        return new SelectionSessionManager(properties);
    }
}
