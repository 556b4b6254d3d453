package shadeagent.relayer.service.flow;

import shadeagent.relayer.dto.intent.ValidatedIntent;

/**
 * What an execution flow achieved. A completed result with an {@code error} is a
 * partial success: funds moved ({@code txId}) but a later leg failed.
 */
public record FlowResult(
    Outcome outcome,
    String txId,
    String bridgeTxId,
    String depositAddress,
    String depositMemo,
    String expectedAmount,
    String error
) {

    public enum Outcome {
        COMPLETED,
        AWAITING_DEPOSIT,
        AWAITING_INTENTS
    }

    public static FlowResult completed(String txId) {
        return new FlowResult(Outcome.COMPLETED, txId, null, null, null, null, null);
    }

    public static FlowResult bridged(String txId, String bridgeTxId, String depositAddress) {
        return new FlowResult(Outcome.COMPLETED, txId, bridgeTxId, depositAddress, null, null, null);
    }

    public static FlowResult partial(String txId, String error) {
        return new FlowResult(Outcome.COMPLETED, txId, null, null, null, null, error);
    }

    public static FlowResult awaitingDeposit(ValidatedIntent intent) {
        return new FlowResult(Outcome.AWAITING_DEPOSIT, null, null,
            intent.getDepositAddress(), intent.getDepositMemo(), intent.getSourceAmount(), null);
    }

    public static FlowResult awaitingIntents(ValidatedIntent intent) {
        return new FlowResult(Outcome.AWAITING_INTENTS, null, null,
            intent.getDepositAddress(), intent.getDepositMemo(), intent.getSourceAmount(), null);
    }

    public boolean isPartial() {
        return outcome == Outcome.COMPLETED && error != null;
    }
}
