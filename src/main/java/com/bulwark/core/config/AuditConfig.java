package com.bulwark.core.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class AuditConfig {

    /**
     * Report timestamps come from this clock so tests can pin them.
     */
    @Bean
    public Clock auditClock() {
        return Clock.systemUTC();
    }
}
