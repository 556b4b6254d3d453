package shadeagent.relayer.service.queue;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.TimeUnit;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import lombok.extern.slf4j.Slf4j;
import shadeagent.relayer.config.RelayerProperties;
import shadeagent.relayer.dto.intent.IntentMessage;
import shadeagent.relayer.dto.intent.ValidatedIntent;
import shadeagent.relayer.service.persistence.IntentStatusPersistenceService;
import shadeagent.relayer.util.LogSanitizer;

/**
 * In-process reliable queue. Raw tokens are the serialized envelope
 * {@code {"token": ..., "intent": {...}}}, unique per enqueue.
 */
@Component
@Slf4j
public class InMemoryIntentQueue implements IntentQueue {

    private final LinkedBlockingDeque<String> pending = new LinkedBlockingDeque<>();
    private final Map<String, Long> inFlight = new ConcurrentHashMap<>();
    private final List<String> deadLetters = Collections.synchronizedList(new ArrayList<>());

    private final ObjectMapper objectMapper;
    private final IntentStatusPersistenceService persistenceService;
    private final Clock clock;
    private final long visibilityTimeoutMs;
    private final long pollTimeoutMs;
    private final String queueKey;
    private final String deadLetterKey;

    @Autowired
    public InMemoryIntentQueue(ObjectMapper objectMapper, IntentStatusPersistenceService persistenceService,
                               RelayerProperties properties) {
        this(objectMapper, persistenceService, properties, Clock.systemUTC());
    }

    public InMemoryIntentQueue(ObjectMapper objectMapper, IntentStatusPersistenceService persistenceService,
                               RelayerProperties properties, Clock clock) {
        this.objectMapper = objectMapper;
        this.persistenceService = persistenceService;
        this.clock = clock;
        this.visibilityTimeoutMs = properties.getQueue().getVisibilityTimeoutMs();
        this.pollTimeoutMs = properties.getQueue().getPollTimeoutMs();
        this.queueKey = properties.getQueue().getKey();
        this.deadLetterKey = properties.getQueue().getDeadLetterKey();
    }

    @Override
    public void enqueue(ValidatedIntent intent) {
        ObjectNode envelope = objectMapper.createObjectNode();
        envelope.put("token", UUID.randomUUID().toString());
        envelope.set("intent", objectMapper.valueToTree(intent));
        try {
            pending.addLast(objectMapper.writeValueAsString(envelope));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize intent " + intent.getIntentId(), e);
        }
        log.debug("Enqueued intent {} on {}", LogSanitizer.sanitize(intent.getIntentId()), queueKey);
    }

    @Override
    public QueuedIntent fetchNext() {
        requeueExpired();
        String raw;
        try {
            raw = pending.pollFirst(pollTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return QueuedIntent.empty();
        }
        if (raw == null) {
            return QueuedIntent.empty();
        }
        inFlight.put(raw, clock.millis() + visibilityTimeoutMs);
        return new QueuedIntent(decode(raw), raw);
    }

    @Override
    public void ack(String rawToken) {
        inFlight.remove(rawToken);
        pending.remove(rawToken);
    }

    @Override
    public void extendVisibility(String rawToken) {
        if (rawToken == null) {
            return;
        }
        long deadline = clock.millis() + visibilityTimeoutMs;
        if (inFlight.computeIfPresent(rawToken, (key, old) -> deadline) == null && pending.remove(rawToken)) {
            inFlight.put(rawToken, deadline);
            log.debug("Reclaimed queue item whose lease expired while in progress");
        }
    }

    @Override
    public void moveToDeadLetter(String rawToken) {
        inFlight.remove(rawToken);
        deadLetters.add(rawToken);
        persistenceService.recordDeadLetter(rawToken);
        log.error("Moved queue item to {}", deadLetterKey);
    }

    @Override
    public List<String> deadLetters() {
        synchronized (deadLetters) {
            return List.copyOf(deadLetters);
        }
    }

    void enqueueRaw(String raw) {
        pending.addLast(raw);
    }

    public int pendingCount() {
        return pending.size();
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    /**
     * Makes items whose visibility timeout elapsed without an ack available again.
     */
    void requeueExpired() {
        long now = clock.millis();
        Iterator<Map.Entry<String, Long>> it = inFlight.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, Long> entry = it.next();
            if (entry.getValue() <= now) {
                it.remove();
                pending.addFirst(entry.getKey());
                log.warn("Queue item visibility expired, redelivering");
            }
        }
    }

    private IntentMessage decode(String raw) {
        try {
            JsonNode envelope = objectMapper.readTree(raw);
            JsonNode intent = envelope.get("intent");
            if (intent == null || intent.isNull()) {
                return null;
            }
            return objectMapper.treeToValue(intent, IntentMessage.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Undecodable queue item: {}", LogSanitizer.sanitize(e.getMessage()));
            return null;
        }
    }
}
