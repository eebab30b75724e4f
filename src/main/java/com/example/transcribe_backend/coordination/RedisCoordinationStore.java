package com.example.transcribe_backend.coordination;

import com.example.transcribe_backend.exception.CoordinationStoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Redis backed coordination store. Conditional writes run as Lua scripts so they are atomic on
 * the server.
 */
public class RedisCoordinationStore implements CoordinationStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(RedisCoordinationStore.class);

    private static final RedisScript<Long> COMPARE_AND_SET = new DefaultRedisScript<>("""
            if redis.call('GET', KEYS[1]) == ARGV[1] then
              redis.call('SET', KEYS[1], ARGV[2], 'PX', ARGV[3])
              return 1
            end
            return 0
            """, Long.class);

    private static final RedisScript<Long> DELETE_IF_EQUALS = new DefaultRedisScript<>("""
            if redis.call('GET', KEYS[1]) == ARGV[1] then
              return redis.call('DEL', KEYS[1])
            end
            return 0
            """, Long.class);

    private final StringRedisTemplate redis;
    private final RedisMessageListenerContainer listenerContainer;

    public RedisCoordinationStore(StringRedisTemplate redis, RedisMessageListenerContainer listenerContainer) {
        this.redis = redis;
        this.listenerContainer = listenerContainer;
    }

    @Override
    public Optional<String> get(String key) {
        return call("get " + key, () -> Optional.ofNullable(redis.opsForValue().get(key)));
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        call("set " + key, () -> {
            redis.opsForValue().set(key, value, ttl);
            return null;
        });
    }

    @Override
    public boolean setIfAbsent(String key, String value, Duration ttl) {
        return call("setIfAbsent " + key, () -> Boolean.TRUE.equals(redis.opsForValue().setIfAbsent(key, value, ttl)));
    }

    @Override
    public boolean compareAndSet(String key, String expected, String value, Duration ttl) {
        return call("compareAndSet " + key, () -> {
            Long updated = redis.execute(COMPARE_AND_SET, List.of(key), expected, value, String.valueOf(ttl.toMillis()));
            return updated != null && updated == 1L;
        });
    }

    @Override
    public boolean delete(String key) {
        return call("delete " + key, () -> Boolean.TRUE.equals(redis.delete(key)));
    }

    @Override
    public boolean deleteIfEquals(String key, String expected) {
        return call("deleteIfEquals " + key, () -> {
            Long deleted = redis.execute(DELETE_IF_EQUALS, List.of(key), expected);
            return deleted != null && deleted > 0;
        });
    }

    @Override
    public void addMember(String setKey, String member) {
        call("sadd " + setKey, () -> redis.opsForSet().add(setKey, member));
    }

    @Override
    public void removeMember(String setKey, String member) {
        call("srem " + setKey, () -> redis.opsForSet().remove(setKey, member));
    }

    @Override
    public Set<String> members(String setKey) {
        return call("smembers " + setKey, () -> {
            Set<String> members = redis.opsForSet().members(setKey);
            return members == null ? Set.of() : members;
        });
    }

    @Override
    public void publish(String channel, String message) {
        call("publish " + channel, () -> redis.convertAndSend(channel, message));
    }

    @Override
    public Subscription subscribe(String channel, Consumer<String> listener) {
        ChannelTopic topic = new ChannelTopic(channel);
        MessageListener messageListener = (message, pattern) -> {
            try {
                listener.accept(new String(message.getBody(), StandardCharsets.UTF_8));
            } catch (RuntimeException e) {
                LOGGER.warn("Listener on channel={} failed: {}", channel, e.toString());
            }
        };
        call("subscribe " + channel, () -> {
            listenerContainer.addMessageListener(messageListener, topic);
            return null;
        });
        AtomicBoolean closed = new AtomicBoolean(false);
        return () -> {
            if (closed.compareAndSet(false, true)) {
                listenerContainer.removeMessageListener(messageListener, topic);
            }
        };
    }

    @Override
    public void ping() {
        call("ping", () -> redis.execute((RedisCallback<String>) RedisConnection::ping));
    }

    private <T> T call(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new CoordinationStoreUnavailableException("Redis " + operation + " failed", e);
        }
    }
}
