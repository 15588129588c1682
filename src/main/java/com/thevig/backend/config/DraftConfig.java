package com.thevig.backend.config;

import com.thevig.backend.notification.LoggingNotificationSink;
import com.thevig.backend.notification.NotificationSink;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.annotation.EnableRetry;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.Random;

@Configuration
@EnableRetry
public class DraftConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Source of randomness for draft order shuffling.
     */
    @Bean
    @ConditionalOnMissingBean(Random.class)
    public Random draftOrderRandom() {
        return new SecureRandom();
    }

    /**
     * Delivery is owned by the notification subsystem; until one registers its
     * own sink, notifications are only logged.
     */
    @Bean
    @ConditionalOnMissingBean
    public NotificationSink notificationSink() {
        return new LoggingNotificationSink();
    }
}
