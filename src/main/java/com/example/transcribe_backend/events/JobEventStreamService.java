package com.example.transcribe_backend.events;

import com.example.transcribe_backend.config.EventStreamProperties;
import com.example.transcribe_backend.coordination.CoordinationStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Bridges an owner's event channel to a server-sent event stream. The subscription lives exactly
 * as long as the client connection.
 */
@Service
public class JobEventStreamService {
    private static final Logger LOGGER = LoggerFactory.getLogger(JobEventStreamService.class);

    private final JobEventBus eventBus;
    private final EventStreamProperties properties;

    public JobEventStreamService(JobEventBus eventBus, EventStreamProperties properties) {
        this.eventBus = eventBus;
        this.properties = properties;
    }

    public SseEmitter open(long ownerId) {
        SseEmitter emitter = new SseEmitter(properties.getEmitterTimeout().toMillis());
        AtomicReference<CoordinationStore.Subscription> subscription = new AtomicReference<>();

        subscription.set(eventBus.subscribe(ownerId, event -> forward(ownerId, emitter, event, subscription)));
        emitter.onCompletion(() -> close(subscription));
        emitter.onTimeout(() -> {
            close(subscription);
            emitter.complete();
        });
        emitter.onError(e -> close(subscription));
        LOGGER.debug("Event stream opened owner={}", ownerId);
        return emitter;
    }

    private void forward(long ownerId,
                         SseEmitter emitter,
                         JobChangeEvent event,
                         AtomicReference<CoordinationStore.Subscription> subscription) {
        try {
            emitter.send(SseEmitter.event()
                    .name(event.kind().wireName())
                    .data(Map.of("jobId", event.jobId(), "kind", event.kind().wireName()), MediaType.APPLICATION_JSON));
        } catch (IOException | IllegalStateException e) {
            LOGGER.debug("Event stream closed owner={} err={}", ownerId, e.toString());
            close(subscription);
            emitter.completeWithError(e);
        }
    }

    private static void close(AtomicReference<CoordinationStore.Subscription> subscription) {
        CoordinationStore.Subscription s = subscription.getAndSet(null);
        if (s != null) {
            s.close();
        }
    }
}
