package shadeagent.relayer.service.flow;

import java.util.List;

/**
 * Builds and broadcasts destination-chain transactions (swap aggregator, lending
 * protocol and token transfer instructions). Signing stays with the relayer.
 */
public interface LedgerGateway {

    PreparedTransaction prepare(TransactionRequest request);

    /**
     * Attaches {@code signatures} in signer order and submits the transaction.
     *
     * @return confirmed transaction id
     */
    String broadcast(PreparedTransaction transaction, List<byte[]> signatures);
}
