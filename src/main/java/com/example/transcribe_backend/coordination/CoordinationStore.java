package com.example.transcribe_backend.coordination;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Shared ephemeral key-value and pub/sub store reachable by every replica. Holds no durable truth:
 * anything written here may disappear (TTL expiry, flush) and callers must recover from the
 * durable job store.
 *
 * <p>All methods throw
 * {@link com.example.transcribe_backend.exception.CoordinationStoreUnavailableException} when the
 * store cannot be reached.
 */
public interface CoordinationStore {

    Optional<String> get(String key);

    void set(String key, String value, Duration ttl);

    /** @return {@code true} if the key did not exist and was written */
    boolean setIfAbsent(String key, String value, Duration ttl);

    /**
     * Replaces the value only if it currently equals {@code expected}.
     *
     * @return {@code true} if the value was replaced
     */
    boolean compareAndSet(String key, String expected, String value, Duration ttl);

    boolean delete(String key);

    /** Deletes the key only if it currently holds {@code expected}. */
    boolean deleteIfEquals(String key, String expected);

    void addMember(String setKey, String member);

    void removeMember(String setKey, String member);

    Set<String> members(String setKey);

    void publish(String channel, String message);

    /**
     * Registers a listener for a channel. Delivery is best effort: messages published while the
     * subscription is not active are lost.
     */
    Subscription subscribe(String channel, Consumer<String> listener);

    /** Round-trip used by health checks. */
    void ping();

    /**
     * Handle of an active channel subscription. Closing it is idempotent.
     */
    interface Subscription extends AutoCloseable {
        @Override
        void close();
    }
}
