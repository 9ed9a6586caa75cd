package com.github.raff.webhook.config;

import com.github.raff.webhook.sync.LoggingPlatformSyncGateway;
import com.github.raff.webhook.sync.PlatformSyncGateway;
import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.ReactiveTransactionManager;
import org.springframework.transaction.reactive.TransactionalOperator;

@Configuration
@EnableConfigurationProperties({
        WebhookProperties.class
})
public class WebhookAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Explicit transaction scope for attribution: commission, aggregates and signals commit together. */
    @Bean
    public TransactionalOperator transactionalOperator(ReactiveTransactionManager txm) {
        return TransactionalOperator.create(txm);
    }

    @Bean
    @ConditionalOnMissingBean(PlatformSyncGateway.class)
    public PlatformSyncGateway platformSyncGateway() {
        return new LoggingPlatformSyncGateway();
    }
}
