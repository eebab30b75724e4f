package com.example.transcribe_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Settings for owner-facing server-sent event streams.
 */
@ConfigurationProperties(prefix = "events")
public class EventStreamProperties {
    private Duration emitterTimeout = Duration.ofMinutes(30);

    public Duration getEmitterTimeout() {
        return emitterTimeout;
    }

    public void setEmitterTimeout(Duration emitterTimeout) {
        this.emitterTimeout = emitterTimeout;
    }
}
