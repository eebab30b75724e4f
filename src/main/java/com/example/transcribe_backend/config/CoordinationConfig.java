package com.example.transcribe_backend.config;

import com.example.transcribe_backend.coordination.CoordinationKeys;
import com.example.transcribe_backend.coordination.CoordinationStore;
import com.example.transcribe_backend.coordination.InMemoryCoordinationStore;
import com.example.transcribe_backend.coordination.RedisCoordinationStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

import java.time.Clock;

/**
 * Wires the coordination store shared by all replicas. Redis is the default; the in-memory
 * variant only makes sense for a single replica.
 */
@Configuration
@EnableConfigurationProperties(CoordinationProperties.class)
public class CoordinationConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(CoordinationConfig.class);

    @Bean
    public CoordinationKeys coordinationKeys(CoordinationProperties properties) {
        return new CoordinationKeys(properties.getKeyPrefix());
    }

    @Bean
    @ConditionalOnProperty(prefix = "coordination", name = "store", havingValue = "redis", matchIfMissing = true)
    public RedisMessageListenerContainer redisMessageListenerContainer(RedisConnectionFactory connectionFactory) {
        RedisMessageListenerContainer container = new RedisMessageListenerContainer();
        container.setConnectionFactory(connectionFactory);
        return container;
    }

    @Bean
    @ConditionalOnProperty(prefix = "coordination", name = "store", havingValue = "redis", matchIfMissing = true)
    public CoordinationStore redisCoordinationStore(StringRedisTemplate redisTemplate,
                                                    RedisMessageListenerContainer listenerContainer) {
        LOGGER.info("Coordination store wired: redis");
        return new RedisCoordinationStore(redisTemplate, listenerContainer);
    }

    @Bean
    @ConditionalOnProperty(prefix = "coordination", name = "store", havingValue = "memory")
    public CoordinationStore inMemoryCoordinationStore(Clock clock) {
        LOGGER.warn("Coordination store wired: in-memory (single replica only)");
        return new InMemoryCoordinationStore(clock);
    }
}
