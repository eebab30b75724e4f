package com.example.transcribe_backend.events;

import com.example.transcribe_backend.coordination.CoordinationKeys;
import com.example.transcribe_backend.coordination.CoordinationStore;
import com.example.transcribe_backend.exception.CoordinationStoreUnavailableException;
import com.example.transcribe_backend.util.JobEventKind;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.function.Consumer;

/**
 * Broadcasts job changes through the coordination store so that whichever replica holds an
 * owner's live connection can forward them. Each owner has its own channel.
 */
@Service
public class JobEventBus {
    private static final Logger LOGGER = LoggerFactory.getLogger(JobEventBus.class);

    private final CoordinationStore store;
    private final CoordinationKeys keys;
    private final ObjectMapper mapper;

    public JobEventBus(CoordinationStore store, CoordinationKeys keys, ObjectMapper mapper) {
        this.store = store;
        this.keys = keys;
        this.mapper = mapper;
    }

    /**
     * Publishes a change. Delivery is best effort; a store outage is logged and the change stays
     * visible through the durable job store.
     */
    public void publish(long ownerId, long jobId, JobEventKind kind) {
        String message;
        try {
            message = mapper.writeValueAsString(Map.of("jobId", jobId, "kind", kind.wireName()));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Serialize job event failed", e);
        }
        try {
            store.publish(keys.ownerEvents(ownerId), message);
            LOGGER.debug("Event published owner={} jobId={} kind={}", ownerId, jobId, kind.wireName());
        } catch (CoordinationStoreUnavailableException e) {
            LOGGER.warn("Event dropped owner={} jobId={} kind={} reason={}", ownerId, jobId, kind.wireName(), e.getMessage());
        }
    }

    /**
     * Subscribes to the changes of one owner's jobs. Close the returned handle when the client
     * disconnects.
     */
    public CoordinationStore.Subscription subscribe(long ownerId, Consumer<JobChangeEvent> listener) {
        return store.subscribe(keys.ownerEvents(ownerId), raw -> {
            JobChangeEvent event = decode(raw);
            if (event != null) {
                listener.accept(event);
            }
        });
    }

    private JobChangeEvent decode(String raw) {
        try {
            var node = mapper.readTree(raw);
            return new JobChangeEvent(node.get("jobId").asLong(), JobEventKind.fromWireName(node.get("kind").asText()));
        } catch (JsonProcessingException | RuntimeException e) {
            LOGGER.warn("Ignoring malformed job event payload={} err={}", raw, e.toString());
            return null;
        }
    }
}
