package shadeagent.relayer.service.status;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.UnaryOperator;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import shadeagent.relayer.config.RelayerProperties;
import shadeagent.relayer.dto.intent.IntentState;
import shadeagent.relayer.dto.intent.IntentStatus;
import shadeagent.relayer.service.persistence.IntentStatusPersistenceService;

/**
 * Status store backed by a concurrent map with a time-to-live, written through to
 * the database when one is configured.
 */
@Component
@Slf4j
public class InMemoryIntentStatusStore implements IntentStatusStore {

    private final Map<String, IntentStatus> statuses = new ConcurrentHashMap<>();
    private final IntentStatusPersistenceService persistenceService;
    private final Duration ttl;
    private final Clock clock;

    @Autowired
    public InMemoryIntentStatusStore(IntentStatusPersistenceService persistenceService, RelayerProperties properties) {
        this(persistenceService, properties, Clock.systemUTC());
    }

    InMemoryIntentStatusStore(IntentStatusPersistenceService persistenceService, RelayerProperties properties, Clock clock) {
        this.persistenceService = persistenceService;
        this.ttl = Duration.ofSeconds(properties.getStatus().getTtlSeconds());
        this.clock = clock;
    }

    @PostConstruct
    public void loadNonTerminal() {
        List<IntentStatus> stored = persistenceService.findNonTerminal();
        int loaded = 0;
        for (IntentStatus status : stored) {
            if (status == null || status.getIntentId() == null) {
                continue;
            }
            statuses.putIfAbsent(status.getIntentId(), status);
            loaded++;
        }
        if (loaded > 0) {
            log.info("Restored {} non-terminal intent statuses", loaded);
        }
    }

    @Override
    public void setStatus(String intentId, IntentStatus status) {
        IntentStatus stamped = stamp(status);
        statuses.put(intentId, stamped);
        persistenceService.upsert(stamped);
    }

    @Override
    public Optional<IntentStatus> getStatus(String intentId) {
        IntentStatus status = statuses.get(intentId);
        if (status != null && isExpired(status)) {
            statuses.remove(intentId, status);
            return Optional.empty();
        }
        return Optional.ofNullable(status);
    }

    @Override
    public List<IntentStatus> getIntentsByState(IntentState state) {
        return statuses.values().stream()
            .filter(s -> s.getState() == state && !isExpired(s))
            .sorted(Comparator.comparing(IntentStatus::getUpdatedAt, Comparator.nullsFirst(Comparator.naturalOrder())))
            .toList();
    }

    @Override
    public IntentStatus update(String intentId, UnaryOperator<IntentStatus> mutation) {
        IntentStatus result = statuses.compute(intentId, (id, current) -> {
            IntentStatus live = current != null && isExpired(current) ? null : current;
            IntentStatus next = mutation.apply(live);
            return next != null ? stamp(next) : null;
        });
        if (result != null) {
            persistenceService.upsert(result);
        }
        return result;
    }

    @Override
    public boolean transition(String intentId, IntentState expected, IntentStatus next) {
        AtomicBoolean applied = new AtomicBoolean(false);
        IntentStatus result = statuses.computeIfPresent(intentId, (id, current) -> {
            if (current.getState() != expected) {
                return current;
            }
            applied.set(true);
            return stamp(next);
        });
        if (applied.get()) {
            persistenceService.upsert(result);
        }
        return applied.get();
    }

    @Scheduled(fixedDelayString = "${relayer.status.cleanup-interval-ms:3600000}")
    public void evictExpired() {
        int before = statuses.size();
        statuses.values().removeIf(this::isExpired);
        int evicted = before - statuses.size();
        int purged = persistenceService.deleteOlderThan(clock.instant().minus(ttl));
        if (evicted > 0 || purged > 0) {
            log.info("Evicted {} expired statuses ({} persisted rows)", evicted, purged);
        }
    }

    private IntentStatus stamp(IntentStatus status) {
        return status.toBuilder().updatedAt(clock.instant()).build();
    }

    private boolean isExpired(IntentStatus status) {
        Instant updatedAt = status.getUpdatedAt();
        return updatedAt != null && updatedAt.plus(ttl).isBefore(clock.instant());
    }
}
