package shadeagent.relayer.service.intent;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import shadeagent.relayer.dto.intent.IntentAckResponse;
import shadeagent.relayer.dto.intent.IntentMessage;
import shadeagent.relayer.dto.intent.IntentStatus;
import shadeagent.relayer.dto.intent.IntentStatusResponse;
import shadeagent.relayer.dto.intent.ValidatedIntent;
import shadeagent.relayer.exception.IntentValidationException;
import shadeagent.relayer.service.queue.IntentQueue;
import shadeagent.relayer.service.status.IntentStatusStore;
import shadeagent.relayer.util.LogSanitizer;

/**
 * Entry point for intent submission and status queries.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IntentService {

    private final IntentValidator validator;
    private final IntentAuthorizationService authorizationService;
    private final IntentQueue queue;
    private final IntentStatusStore statusStore;

    public ValidatedIntent validate(IntentMessage raw) {
        return validator.validate(raw);
    }

    /**
     * Validates, authorizes and enqueues an intent submitted from outside.
     */
    public IntentAckResponse submit(IntentMessage raw) {
        if (raw != null && raw.getMetadata() != null && raw.getMetadata().containsKey(ValidatedIntent.INTENTS_COMPLETED)) {
            throw new IntentValidationException("metadata." + ValidatedIntent.INTENTS_COMPLETED,
                "metadata." + ValidatedIntent.INTENTS_COMPLETED + " is reserved");
        }
        ValidatedIntent intent = validator.validate(raw);
        authorizationService.authorize(intent);
        return enqueueValidated(intent);
    }

    /**
     * Records a pending status and enqueues. Re-submitting a known intent id returns its
     * current state without enqueueing again.
     */
    public IntentAckResponse enqueueValidated(ValidatedIntent intent) {
        AtomicBoolean created = new AtomicBoolean(false);
        IntentStatus stored = statusStore.update(intent.getIntentId(), current -> {
            if (current != null) {
                return current;
            }
            created.set(true);
            return IntentStatus.pending(intent);
        });
        if (!created.get()) {
            log.info("Intent {} already known in state {}", LogSanitizer.sanitize(intent.getIntentId()),
                stored.getState().getWireValue());
            return new IntentAckResponse(intent.getIntentId(), stored.getState().getWireValue(), "duplicate", null);
        }
        queue.enqueue(intent);
        log.info("Intent {} accepted ({})", LogSanitizer.sanitize(intent.getIntentId()), intent.action().getWireValue());
        return new IntentAckResponse(intent.getIntentId(), stored.getState().getWireValue(), null, Instant.now().toString());
    }

    public IntentStatusResponse queryStatus(String intentId) {
        return statusStore.getStatus(intentId)
            .map(IntentStatusResponse::from)
            .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Intent not found"));
    }
}
