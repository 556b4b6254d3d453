package shadeagent.relayer.service.intent;

import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

import org.springframework.stereotype.Service;

import lombok.extern.slf4j.Slf4j;
import shadeagent.relayer.config.RelayerProperties;
import shadeagent.relayer.dto.intent.IntentState;
import shadeagent.relayer.dto.intent.IntentStatus;
import shadeagent.relayer.dto.intent.ValidatedIntent;
import shadeagent.relayer.exception.IntentAuthorizationException;
import shadeagent.relayer.exception.IntentValidationException;
import shadeagent.relayer.service.flow.ExecutionFlow;
import shadeagent.relayer.service.flow.FlowResult;
import shadeagent.relayer.service.queue.IntentQueue;
import shadeagent.relayer.service.queue.QueuedIntent;
import shadeagent.relayer.service.status.IntentStatusStore;
import shadeagent.relayer.util.LogSanitizer;

/**
 * Drives one queue item to an outcome: re-validation, authorization, routing and a
 * bounded in-process retry with linear backoff. Items are acknowledged whatever the
 * outcome; exhausted items are also copied to the dead-letter store.
 * <p>
 * Only one delivery of an intent executes at a time: a redelivery that arrives while
 * another worker owns the intent is skipped, as is a stale delivery of an intent that
 * is already terminal or parked waiting for settlement.
 */
@Service
@Slf4j
public class IntentProcessor {

    private final IntentQueue queue;
    private final IntentStatusStore statusStore;
    private final IntentValidator validator;
    private final IntentAuthorizationService authorizationService;
    private final IntentRouter router;
    private final int maxAttempts;
    private final long retryBackoffMs;
    private final Set<String> activeIntents = ConcurrentHashMap.newKeySet();

    public IntentProcessor(
        IntentQueue queue,
        IntentStatusStore statusStore,
        IntentValidator validator,
        IntentAuthorizationService authorizationService,
        IntentRouter router,
        RelayerProperties properties
    ) {
        this.queue = queue;
        this.statusStore = statusStore;
        this.validator = validator;
        this.authorizationService = authorizationService;
        this.router = router;
        this.maxAttempts = Math.max(1, properties.getQueue().getMaxAttempts());
        this.retryBackoffMs = Math.max(0, properties.getQueue().getRetryBackoffMs());
    }

    public void process(QueuedIntent item) {
        if (item == null || item.isEmpty()) {
            return;
        }
        String raw = item.rawToken();
        if (item.intent() == null) {
            log.warn("Dropping undecodable queue item");
            queue.ack(raw);
            return;
        }

        String intentId = item.intent().getIntentId();
        boolean claimed = false;
        boolean acknowledge = true;
        try {
            Optional<IntentStatus> current = intentId == null ? Optional.empty() : statusStore.getStatus(intentId);
            if (current.isPresent() && (current.get().isTerminal() || current.get().getState().isAwaiting())) {
                log.info("Intent {} already {}, skipping redelivery", LogSanitizer.sanitize(intentId),
                    current.get().getState().getWireValue());
                return;
            }
            if (intentId != null) {
                claimed = activeIntents.add(intentId);
                if (!claimed) {
                    // the delivery that owns the intent acknowledges the item when it finishes
                    log.warn("Intent {} is already being processed, skipping redelivery", LogSanitizer.sanitize(intentId));
                    acknowledge = false;
                    return;
                }
            }
            ValidatedIntent intent = validator.validate(item.intent());
            authorizationService.authorize(intent);
            acknowledge = processWithRetry(intent, raw);
        } catch (IntentValidationException | IntentAuthorizationException e) {
            // rejected before execution; does not consume the retry budget
            log.warn("Intent {} rejected: {}", LogSanitizer.sanitize(intentId), LogSanitizer.sanitize(e.getMessage()));
            markFailed(intentId, null, e.getMessage(), null);
        } catch (RuntimeException e) {
            log.error("Intent {} processing failed: {}", LogSanitizer.sanitize(intentId), LogSanitizer.sanitize(e.getMessage()), e);
            markFailed(intentId, null, e.getMessage() != null ? e.getMessage() : "unknown error", null);
        } finally {
            if (acknowledge) {
                queue.ack(raw);
            }
            if (claimed) {
                activeIntents.remove(intentId);
            }
        }
    }

    /**
     * @return false when interrupted during backoff; the item must then stay unacknowledged
     */
    boolean processWithRetry(ValidatedIntent intent, String raw) {
        String intentId = intent.getIntentId();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            int current = attempt;
            queue.extendVisibility(raw);
            statusStore.update(intentId, status -> base(status, intent)
                .state(IntentState.PROCESSING)
                .attempt(current)
                .error(null)
                .detail("attempt " + current + "/" + maxAttempts)
                .build());
            try {
                ExecutionFlow flow = router.resolve(intent);
                FlowResult result = flow.execute(intent);
                publishResult(intent, current, flow, result);
                return true;
            } catch (RuntimeException e) {
                String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                log.warn("Intent {} failed on attempt {}/{}: {}", LogSanitizer.sanitize(intentId), current, maxAttempts,
                    LogSanitizer.sanitize(error));
                if (current >= maxAttempts) {
                    markFailed(intentId, intent, error, current);
                    queue.moveToDeadLetter(raw);
                    log.error("Intent {} exhausted {} attempts, moved to dead letter", LogSanitizer.sanitize(intentId), maxAttempts);
                    return true;
                }
                statusStore.update(intentId, status -> base(status, intent)
                    .state(IntentState.PROCESSING)
                    .attempt(current)
                    .detail("retrying (attempt " + (current + 1) + "/" + maxAttempts + ")")
                    .error(error)
                    .build());
                try {
                    backoff(retryBackoffMs * current);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    log.warn("Intent {} interrupted during backoff, leaving for redelivery", LogSanitizer.sanitize(intentId));
                    return false;
                }
            }
        }
        return true;
    }

    private void publishResult(ValidatedIntent intent, int attempt, ExecutionFlow flow, FlowResult result) {
        String intentId = intent.getIntentId();
        switch (result.outcome()) {
            case COMPLETED -> {
                statusStore.update(intentId, status -> base(status, intent)
                    .state(IntentState.SUCCEEDED)
                    .attempt(attempt)
                    .txId(result.txId())
                    .bridgeTxId(result.bridgeTxId())
                    .depositAddress(result.depositAddress() != null ? result.depositAddress() : intent.getDepositAddress())
                    .error(result.error())
                    .detail(result.isPartial() ? flow.name() + " partially completed" : flow.name() + " completed")
                    .build());
                if (result.isPartial()) {
                    log.warn("Intent {} partially succeeded: tx {} ({})", LogSanitizer.sanitize(intentId), result.txId(),
                        LogSanitizer.sanitize(result.error()));
                } else {
                    log.info("Intent {} succeeded via {}: tx {}", LogSanitizer.sanitize(intentId), flow.name(), result.txId());
                }
            }
            case AWAITING_DEPOSIT, AWAITING_INTENTS -> {
                IntentState state = result.outcome() == FlowResult.Outcome.AWAITING_DEPOSIT
                    ? IntentState.AWAITING_DEPOSIT
                    : IntentState.AWAITING_INTENTS;
                statusStore.update(intentId, status -> base(status, intent)
                    .state(state)
                    .attempt(attempt)
                    .depositAddress(result.depositAddress())
                    .depositMemo(result.depositMemo())
                    .expectedAmount(result.expectedAmount())
                    .awaitingSince(Instant.now())
                    .error(null)
                    .detail("waiting for settlement")
                    .build());
                log.info("Intent {} parked in {} on {}", LogSanitizer.sanitize(intentId), state.getWireValue(),
                    LogSanitizer.maskIdentifier(result.depositAddress()));
            }
        }
    }

    private void markFailed(String intentId, ValidatedIntent intent, String error, Integer attempt) {
        if (intentId == null) {
            return;
        }
        statusStore.update(intentId, status -> {
            IntentStatus.IntentStatusBuilder builder = status != null
                ? status.toBuilder()
                : IntentStatus.builder().intentId(intentId).intentData(intent);
            if (attempt != null) {
                builder.attempt(attempt);
            }
            return builder.state(IntentState.FAILED).error(error).detail(null).build();
        });
    }

    private static IntentStatus.IntentStatusBuilder base(IntentStatus status, ValidatedIntent intent) {
        IntentStatus.IntentStatusBuilder builder = status != null ? status.toBuilder() : IntentStatus.builder();
        return builder.intentId(intent.getIntentId()).intentData(intent);
    }

    void backoff(long millis) throws InterruptedException {
        if (millis > 0) {
            TimeUnit.MILLISECONDS.sleep(millis);
        }
    }
}
