package shadeagent.relayer.service.flow;

import java.math.BigInteger;
import java.util.List;

import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import shadeagent.relayer.config.RelayerProperties;
import shadeagent.relayer.dto.intent.ValidatedIntent;
import shadeagent.relayer.exception.FlowExecutionException;
import shadeagent.relayer.service.custody.CustodyPathDeriver;
import shadeagent.relayer.service.custody.CustodySigner;
import shadeagent.relayer.util.LogSanitizer;

/**
 * Default flow: swaps the funds delivered to the user's custody account into the final
 * asset, sending the output to {@code userDestination}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ChainSwapFlow implements ExecutionFlow {

    private final RelayerProperties properties;
    private final CustodyPathDeriver pathDeriver;
    private final CustodySigner custodySigner;
    private final LedgerGateway ledgerGateway;

    @Override
    public String name() {
        return "chain-swap";
    }

    @Override
    public boolean supports(ValidatedIntent intent) {
        return true;
    }

    @Override
    public FlowResult execute(ValidatedIntent intent) {
        if (properties.isDryRun()) {
            return FlowResult.completed("dry-run-" + intent.getIntentId());
        }
        if (intent.getDepositAddress() != null && !intent.externallySettled()) {
            // the settlement leg must deliver funds before the swap can run
            return intent.getOriginTxHash() == null
                ? FlowResult.awaitingDeposit(intent)
                : FlowResult.awaitingIntents(intent);
        }
        if (intent.getUserDestination() == null) {
            throw new FlowExecutionException("swap", "Missing userDestination for intent " + intent.getIntentId());
        }

        String ownerPath = pathDeriver.solanaUserPath(intent.getUserDestination());
        String txId = custodySigner.withPathLocks(List.of(ownerPath), () -> {
            String owner = custodySigner.deriveAddress(ownerPath);
            TransactionRequest request = TransactionRequest.builder()
                .kind(TransactionKind.SWAP)
                .feePayer(owner)
                .owner(owner)
                .inputMint(SolanaAssets.extractMintAddress(
                    intent.getIntermediateAsset() != null ? intent.getIntermediateAsset() : intent.getSourceAsset()))
                .outputMint(SolanaAssets.extractMintAddress(intent.getFinalAsset()))
                .amount(swapAmount(intent))
                .slippageBps(intent.getSlippageBps())
                .recipient(intent.getUserDestination())
                .build();
            PreparedTransaction transaction = ledgerGateway.prepare(request);
            return ledgerGateway.broadcast(transaction, custodySigner.signAll(transaction.messageHex(), List.of(ownerPath)));
        });
        log.info("Swap for intent {} confirmed: {}", LogSanitizer.sanitize(intent.getIntentId()), txId);
        return FlowResult.completed(txId);
    }

    /**
     * Amount swapped, keeping back a rent reserve for the destination token account
     * unless the amount is too small to cover it.
     */
    String swapAmount(ValidatedIntent intent) {
        String raw = intent.getIntermediateAmount() != null ? intent.getIntermediateAmount()
            : intent.getDestinationAmount() != null ? intent.getDestinationAmount()
            : intent.getSourceAmount();
        BigInteger amount = new BigInteger(raw);
        BigInteger reserve = BigInteger.valueOf(properties.getLedger().getRentReserveLamports());
        return amount.compareTo(reserve) > 0 ? amount.subtract(reserve).toString() : raw;
    }
}
