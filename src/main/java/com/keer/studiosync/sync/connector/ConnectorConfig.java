package com.keer.studiosync.sync.connector;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Connectors are deployment specific; without one registered, sync runs ingest nothing.
 */
@Configuration
public class ConnectorConfig {

    @Bean
    @ConditionalOnMissingBean
    public MailConnector mailConnector() {
        return new NoOpMailConnector();
    }

    @Bean
    @ConditionalOnMissingBean
    public AutomationConnector automationConnector() {
        return new NoOpAutomationConnector();
    }
}
