package com.example.transcribe_backend.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Enables application-specific configuration properties.
 */
@Configuration
@EnableConfigurationProperties({DispatchProperties.class, EventStreamProperties.class})
public class AppPropertiesConfig {
}
