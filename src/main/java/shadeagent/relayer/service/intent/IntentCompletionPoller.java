package shadeagent.relayer.service.intent;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import lombok.extern.slf4j.Slf4j;
import shadeagent.relayer.config.RelayerProperties;
import shadeagent.relayer.dto.intent.IntentState;
import shadeagent.relayer.dto.intent.IntentStatus;
import shadeagent.relayer.dto.intent.ValidatedIntent;
import shadeagent.relayer.exception.SettlementTimeoutException;
import shadeagent.relayer.service.queue.IntentQueue;
import shadeagent.relayer.service.settlement.ExecutionStatus;
import shadeagent.relayer.service.settlement.SettlementClient;
import shadeagent.relayer.service.status.IntentStatusStore;
import shadeagent.relayer.util.LogSanitizer;

/**
 * Watches parked intents and resumes them once the external swap settles.
 * A completed settlement re-enqueues the stored intent with the completion flag set;
 * a refund or failure ends the intent.
 */
@Service
@Slf4j
public class IntentCompletionPoller {

    private static final Set<String> COMPLETED = Set.of("success", "completed");
    private static final Set<String> FAILED = Set.of("refunded", "failed");
    private static final Set<String> IN_FLIGHT = Set.of("pending", "processing", "pending_deposit", "known_deposit_tx",
        "incomplete_deposit");
    private static final Set<String> DEPOSIT_SEEN = Set.of("processing", "known_deposit_tx");
    static final String TIMEOUT_DETAIL = "settlement timeout";

    private final IntentStatusStore statusStore;
    private final IntentQueue queue;
    private final SettlementClient settlementClient;
    private final RelayerProperties properties;
    private final Clock clock;

    @Autowired
    public IntentCompletionPoller(IntentStatusStore statusStore, IntentQueue queue, SettlementClient settlementClient,
                                  RelayerProperties properties) {
        this(statusStore, queue, settlementClient, properties, Clock.systemUTC());
    }

    IntentCompletionPoller(IntentStatusStore statusStore, IntentQueue queue, SettlementClient settlementClient,
                           RelayerProperties properties, Clock clock) {
        this.statusStore = statusStore;
        this.queue = queue;
        this.settlementClient = settlementClient;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${relayer.poller.interval-ms:5000}")
    public void pollAwaitingIntents() {
        if (!properties.getPoller().isEnabled()) {
            return;
        }
        pollState(IntentState.AWAITING_DEPOSIT);
        pollState(IntentState.AWAITING_INTENTS);
    }

    private void pollState(IntentState state) {
        List<IntentStatus> awaiting = statusStore.getIntentsByState(state);
        for (IntentStatus status : awaiting) {
            try {
                checkIntent(status);
            } catch (RuntimeException e) {
                log.warn("Settlement check for intent {} failed: {}", LogSanitizer.sanitize(status.getIntentId()),
                    LogSanitizer.sanitize(e.getMessage()));
            }
        }
    }

    void checkIntent(IntentStatus status) {
        String intentId = status.getIntentId();
        IntentState current = status.getState();

        try {
            ensureWithinWaitHorizon(status);
        } catch (SettlementTimeoutException e) {
            if (statusStore.transition(intentId, current, status.moveTo(IntentState.FAILED).toBuilder()
                .error(e.getMessage()).detail(TIMEOUT_DETAIL).build())) {
                log.warn("Intent {} failed: {}", LogSanitizer.sanitize(e.getIntentId()), e.getMessage());
            }
            return;
        }

        String depositAddress = status.getDepositAddress();
        if (depositAddress == null || depositAddress.isBlank()) {
            log.debug("Intent {} has no deposit address, skipping", LogSanitizer.sanitize(intentId));
            return;
        }

        ExecutionStatus execution = settlementClient.getExecutionStatus(
            properties.getSettlement().getBaseUrl(), depositAddress, status.getDepositMemo());
        String settlement = execution == null ? "" : execution.normalized();

        if (COMPLETED.contains(settlement)) {
            resume(status);
        } else if (FAILED.contains(settlement)) {
            String error = "Intents swap " + settlement;
            if (statusStore.transition(intentId, current, status.moveTo(IntentState.FAILED).toBuilder()
                .error(error).detail(null).build())) {
                log.warn("Intent {} failed: {}", LogSanitizer.sanitize(intentId), error);
            }
        } else if (current == IntentState.AWAITING_DEPOSIT && DEPOSIT_SEEN.contains(settlement)) {
            if (statusStore.transition(intentId, current, status.moveTo(IntentState.AWAITING_INTENTS).toBuilder()
                .detail("deposit detected, waiting for swap").build())) {
                log.info("Intent {} deposit detected", LogSanitizer.sanitize(intentId));
            }
        } else if (!IN_FLIGHT.contains(settlement)) {
            log.warn("Intent {} has unrecognized settlement status '{}'", LogSanitizer.sanitize(intentId),
                LogSanitizer.sanitize(settlement));
        }
    }

    private void resume(IntentStatus status) {
        String intentId = status.getIntentId();
        ValidatedIntent stored = status.getIntentData();
        if (stored == null) {
            statusStore.transition(intentId, status.getState(), status.moveTo(IntentState.FAILED).toBuilder()
                .error("missing intent data").detail(null).build());
            log.error("Intent {} settled but its intent data is missing", LogSanitizer.sanitize(intentId));
            return;
        }
        ValidatedIntent resumed = stored.withMetadataValue(ValidatedIntent.INTENTS_COMPLETED, true);
        IntentStatus next = status.moveTo(IntentState.PROCESSING).toBuilder()
            .intentData(resumed)
            .detail("Intents swap completed, resuming execution")
            .build();
        if (!statusStore.transition(intentId, status.getState(), next)) {
            log.debug("Intent {} already claimed by another owner", LogSanitizer.sanitize(intentId));
            return;
        }
        queue.enqueue(resumed);
        log.info("Intent {} settlement completed, re-enqueued", LogSanitizer.sanitize(intentId));
    }

    /**
     * @throws SettlementTimeoutException when the intent has waited longer than the configured maximum
     */
    private void ensureWithinWaitHorizon(IntentStatus status) {
        Instant since = status.getAwaitingSince() != null ? status.getAwaitingSince() : status.getUpdatedAt();
        if (since == null) {
            return;
        }
        long maxWaitMs = properties.getPoller().getMaxWaitMs();
        if (Instant.now(clock).isAfter(since.plusMillis(maxWaitMs))) {
            throw new SettlementTimeoutException(status.getIntentId(), Duration.ofMillis(maxWaitMs));
        }
    }
}
