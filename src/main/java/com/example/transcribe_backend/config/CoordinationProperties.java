package com.example.transcribe_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "coordination")
public class CoordinationProperties {
    /** {@code redis} or {@code memory}. */
    private String store = "redis";
    private String keyPrefix = "transcribe";

    public String getStore() { return store; }
    public void setStore(String store) { this.store = store; }

    public String getKeyPrefix() { return keyPrefix; }
    public void setKeyPrefix(String keyPrefix) { this.keyPrefix = keyPrefix; }
}
