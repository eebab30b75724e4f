package com.example.transcribe_backend.config;

import com.example.transcribe_backend.coordination.CoordinationStore;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class HealthConfig {

    @Bean
    public HealthIndicator coordinationStoreHealth(CoordinationStore store) {
        return () -> {
            try {
                store.ping();
                return Health.up().withDetail("coordinationStore", "ok").build();
            } catch (Exception e) {
                // dispatch is fail-closed while the store is down
                return Health.down(e).withDetail("coordinationStore", "unreachable").build();
            }
        };
    }
}
