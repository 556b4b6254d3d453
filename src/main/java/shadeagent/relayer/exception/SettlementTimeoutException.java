package shadeagent.relayer.exception;

import java.time.Duration;

/**
 * Raised when an external settlement leg did not complete within the wait horizon.
 */
public class SettlementTimeoutException extends RuntimeException {

    private final String intentId;

    public SettlementTimeoutException(String intentId, Duration waited) {
        super("Settlement timed out after " + waited.toSeconds() + "s");
        this.intentId = intentId;
    }

    public String getIntentId() {
        return intentId;
    }
}
