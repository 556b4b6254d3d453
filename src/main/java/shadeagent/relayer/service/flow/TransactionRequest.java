package shadeagent.relayer.service.flow;

import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Builder;
import lombok.Value;

/**
 * Unsigned transaction to be built by the ledger gateway. Addresses are base58.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TransactionRequest {
    TransactionKind kind;
    String feePayer;
    String owner;
    String inputMint;
    String outputMint;
    String amount;
    Integer slippageBps;
    String marketAddress;
    String recipient;
}
