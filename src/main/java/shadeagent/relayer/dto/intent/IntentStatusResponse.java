package shadeagent.relayer.dto.intent;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Public view of an {@link IntentStatus}; leaves out the stored intent payload.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IntentStatusResponse(
    String intentId,
    String state,
    Integer attempt,
    String txId,
    String bridgeTxId,
    String depositAddress,
    String depositMemo,
    String expectedAmount,
    String error,
    String detail,
    String updatedAt
) {

    public static IntentStatusResponse from(IntentStatus status) {
        return new IntentStatusResponse(
            status.getIntentId(),
            status.getState().getWireValue(),
            status.getAttempt(),
            status.getTxId(),
            status.getBridgeTxId(),
            status.getDepositAddress(),
            status.getDepositMemo(),
            status.getExpectedAmount(),
            status.getError(),
            status.getDetail(),
            status.getUpdatedAt() != null ? status.getUpdatedAt().toString() : null
        );
    }
}
