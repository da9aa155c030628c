package com.epinet.service.core.config;

import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Clock behind hour bucketing, throttling and refresh markers. Hour keys are UTC, so the default
 * clock is too; a host application may register its own {@link Clock} instead.
 */
@Configuration
public class ClockConfig {

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock epinetClock() {
        return Clock.systemUTC();
    }
}
