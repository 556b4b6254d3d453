package shadeagent.relayer.service.status;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

import shadeagent.relayer.dto.intent.IntentState;
import shadeagent.relayer.dto.intent.IntentStatus;

/**
 * Intent status projection keyed by intent id. Writes for one intent are atomic.
 */
public interface IntentStatusStore {

    void setStatus(String intentId, IntentStatus status);

    Optional<IntentStatus> getStatus(String intentId);

    List<IntentStatus> getIntentsByState(IntentState state);

    /**
     * Applies {@code mutation} to the current status (null when absent) atomically.
     *
     * @return the stored result
     */
    IntentStatus update(String intentId, UnaryOperator<IntentStatus> mutation);

    /**
     * Stores {@code next} only if the intent is currently in {@code expected}.
     *
     * @return false when another owner moved the intent first
     */
    boolean transition(String intentId, IntentState expected, IntentStatus next);
}
