package shadeagent.relayer.dto.intent;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Projection of pipeline progress for one intent.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class IntentStatus {
    String intentId;
    IntentState state;
    Integer attempt;
    String txId;
    String bridgeTxId;
    String depositAddress;
    String depositMemo;
    String expectedAmount;
    String error;
    String detail;
    ValidatedIntent intentData;
    Instant awaitingSince;
    Instant updatedAt;

    public static IntentStatus pending(ValidatedIntent intent) {
        return IntentStatus.builder()
            .intentId(intent.getIntentId())
            .state(IntentState.PENDING)
            .intentData(intent)
            .updatedAt(Instant.now())
            .build();
    }

    /**
     * Copy moved to {@code state}, stamped with the current time.
     */
    public IntentStatus moveTo(IntentState next) {
        return toBuilder().state(next).updatedAt(Instant.now()).build();
    }

    @JsonIgnore
    public boolean isTerminal() {
        return state != null && state.isTerminal();
    }
}
