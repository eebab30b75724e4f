package com.example.transcribe_backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Single time source for heartbeats, sweep cutoffs and job timestamps. Liveness records store
 * epoch millis from this clock, so every replica must run it in UTC.
 */
@Configuration
public class TimeConfig {

    @Bean
    public Clock dispatchClock() {
        return Clock.systemUTC();
    }
}
