package com.example.transcribe_backend.coordination;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Process-local coordination store for single-replica development and tests. TTLs follow the
 * injected clock. Messages are delivered synchronously on the publishing thread.
 */
public class InMemoryCoordinationStore implements CoordinationStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryCoordinationStore.class);

    private record Entry(String value, long expiresAtMillis) {
        boolean expired(long now) {
            return now >= expiresAtMillis;
        }
    }

    private final Clock clock;
    private final Map<String, Entry> values = new HashMap<>();
    private final Map<String, Set<String>> sets = new HashMap<>();
    private final Map<String, List<Consumer<String>>> listeners = new ConcurrentHashMap<>();

    public InMemoryCoordinationStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized Optional<String> get(String key) {
        return Optional.ofNullable(live(key)).map(Entry::value);
    }

    @Override
    public synchronized void set(String key, String value, Duration ttl) {
        values.put(key, new Entry(value, expiry(ttl)));
    }

    @Override
    public synchronized boolean setIfAbsent(String key, String value, Duration ttl) {
        if (live(key) != null) {
            return false;
        }
        values.put(key, new Entry(value, expiry(ttl)));
        return true;
    }

    @Override
    public synchronized boolean compareAndSet(String key, String expected, String value, Duration ttl) {
        Entry current = live(key);
        if (current == null || !Objects.equals(current.value(), expected)) {
            return false;
        }
        values.put(key, new Entry(value, expiry(ttl)));
        return true;
    }

    @Override
    public synchronized boolean delete(String key) {
        return live(key) != null && values.remove(key) != null;
    }

    @Override
    public synchronized boolean deleteIfEquals(String key, String expected) {
        Entry current = live(key);
        if (current == null || !Objects.equals(current.value(), expected)) {
            return false;
        }
        values.remove(key);
        return true;
    }

    @Override
    public synchronized void addMember(String setKey, String member) {
        sets.computeIfAbsent(setKey, k -> new HashSet<>()).add(member);
    }

    @Override
    public synchronized void removeMember(String setKey, String member) {
        Set<String> members = sets.get(setKey);
        if (members != null) {
            members.remove(member);
        }
    }

    @Override
    public synchronized Set<String> members(String setKey) {
        Set<String> members = sets.get(setKey);
        return members == null ? Set.of() : Set.copyOf(members);
    }

    @Override
    public void publish(String channel, String message) {
        for (Consumer<String> listener : listeners.getOrDefault(channel, List.of())) {
            try {
                listener.accept(message);
            } catch (RuntimeException e) {
                LOGGER.warn("Listener on channel={} failed: {}", channel, e.toString());
            }
        }
    }

    @Override
    public Subscription subscribe(String channel, Consumer<String> listener) {
        List<Consumer<String>> channelListeners = listeners.computeIfAbsent(channel, k -> new CopyOnWriteArrayList<>());
        channelListeners.add(listener);
        AtomicBoolean closed = new AtomicBoolean(false);
        return () -> {
            if (closed.compareAndSet(false, true)) {
                channelListeners.remove(listener);
            }
        };
    }

    @Override
    public void ping() {
    }

    /** Number of live listeners on a channel. */
    public int listenerCount(String channel) {
        return listeners.getOrDefault(channel, List.of()).size();
    }

    private Entry live(String key) {
        Entry entry = values.get(key);
        if (entry != null && entry.expired(clock.millis())) {
            values.remove(key);
            return null;
        }
        return entry;
    }

    private long expiry(Duration ttl) {
        return clock.millis() + ttl.toMillis();
    }
}
