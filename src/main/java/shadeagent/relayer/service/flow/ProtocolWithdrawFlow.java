package shadeagent.relayer.service.flow;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import shadeagent.relayer.config.RelayerProperties;
import shadeagent.relayer.dto.intent.IntentAction;
import shadeagent.relayer.dto.intent.ValidatedIntent;
import shadeagent.relayer.exception.FlowExecutionException;
import shadeagent.relayer.service.custody.CustodyPathDeriver;
import shadeagent.relayer.service.custody.CustodySigner;
import shadeagent.relayer.service.settlement.QuoteRequest;
import shadeagent.relayer.service.settlement.QuoteResponse;
import shadeagent.relayer.service.settlement.SettlementClient;
import shadeagent.relayer.util.LogSanitizer;

/**
 * Withdraws from a lending market out of the user's custody account and optionally
 * bridges the proceeds back to another chain through the settlement service.
 * <p>
 * The relayer's own account pays fees (signer index 0); the user's account owns the
 * position (index 1).
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ProtocolWithdrawFlow implements ExecutionFlow {

    static final String BRIDGE_BACK = "bridgeBack";
    static final String DRY_RUN_DEPOSIT_ADDRESS = "dry-run-deposit-address";
    private static final int DEFAULT_BRIDGE_SLIPPAGE_BPS = 300;

    private final RelayerProperties properties;
    private final CustodyPathDeriver pathDeriver;
    private final CustodySigner custodySigner;
    private final LedgerGateway ledgerGateway;
    private final SettlementClient settlementClient;

    @Override
    public String name() {
        return "protocol-withdraw";
    }

    @Override
    public boolean supports(ValidatedIntent intent) {
        return IntentAction.KAMINO_WITHDRAW.getWireValue().equals(intent.actionName())
            && intent.metadataString("marketAddress") != null
            && intent.metadataString("mintAddress") != null;
    }

    @Override
    public FlowResult execute(ValidatedIntent intent) {
        Map<String, Object> bridgeBack = intent.metadataObject(BRIDGE_BACK);
        if (properties.isDryRun()) {
            String txId = "dry-run-kamino-withdraw-" + intent.getIntentId();
            return bridgeBack == null
                ? FlowResult.completed(txId)
                : FlowResult.bridged(txId, "dry-run-bridge-" + intent.getIntentId(), DRY_RUN_DEPOSIT_ADDRESS);
        }
        if (intent.getUserDestination() == null) {
            throw new FlowExecutionException("withdraw", "Lending withdraw requires userDestination");
        }

        String feePayerPath = pathDeriver.solanaSystemPath();
        String ownerPath = pathDeriver.solanaUserPath(intent.getUserDestination());

        String txId = custodySigner.withPathLocks(List.of(feePayerPath, ownerPath), () -> {
            TransactionRequest request = TransactionRequest.builder()
                .kind(TransactionKind.LENDING_WITHDRAW)
                .feePayer(custodySigner.deriveAddress(feePayerPath))
                .owner(custodySigner.deriveAddress(ownerPath))
                .marketAddress(intent.metadataString("marketAddress"))
                .outputMint(intent.metadataString("mintAddress"))
                .amount(intent.getSourceAmount())
                .build();
            PreparedTransaction transaction = ledgerGateway.prepare(request);
            List<byte[]> signatures = custodySigner.signAll(transaction.messageHex(), List.of(feePayerPath, ownerPath));
            return ledgerGateway.broadcast(transaction, signatures);
        });
        log.info("Lending withdraw for intent {} confirmed: {}", LogSanitizer.sanitize(intent.getIntentId()), txId);

        if (bridgeBack == null) {
            return FlowResult.completed(txId);
        }
        try {
            return bridgeBack(intent, bridgeBack, txId, feePayerPath, ownerPath);
        } catch (RuntimeException e) {
            // the withdrawal already moved funds; report it instead of failing the whole intent
            log.warn("Bridge back for intent {} failed after withdraw {}: {}",
                LogSanitizer.sanitize(intent.getIntentId()), txId, LogSanitizer.sanitize(e.getMessage()));
            return FlowResult.partial(txId, "Bridge back failed: " + e.getMessage());
        }
    }

    private FlowResult bridgeBack(ValidatedIntent intent, Map<String, Object> bridgeBack, String withdrawTxId,
                                  String feePayerPath, String ownerPath) {
        String mintAddress = intent.metadataString("mintAddress");
        Object slippage = bridgeBack.get("slippageTolerance");
        QuoteRequest quoteRequest = QuoteRequest.builder()
            .dry(false)
            .originAsset(SolanaAssets.defuseAssetId(mintAddress))
            .destinationAsset(String.valueOf(bridgeBack.get("destinationAsset")))
            .amount(intent.getSourceAmount())
            .slippageTolerance(slippage instanceof Number n ? n.intValue() : DEFAULT_BRIDGE_SLIPPAGE_BPS)
            .recipient(String.valueOf(bridgeBack.get("destinationAddress")))
            .refundTo(intent.getRefundAddress() != null ? intent.getRefundAddress() : intent.getUserDestination())
            .deadline(Instant.now().plus(properties.getSettlement().getQuoteDeadlineMinutes(), ChronoUnit.MINUTES).toString())
            .build();

        QuoteResponse quote = settlementClient.getQuote(properties.getSettlement().getBaseUrl(), quoteRequest);
        if (quote == null || quote.depositAddress() == null || quote.depositAddress().isBlank()) {
            throw new FlowExecutionException("bridge", "Quote response missing depositAddress");
        }

        String bridgeTxId = custodySigner.withPathLocks(List.of(feePayerPath, ownerPath), () -> {
            TransactionRequest transfer = TransactionRequest.builder()
                .kind(TransactionKind.TRANSFER)
                .feePayer(custodySigner.deriveAddress(feePayerPath))
                .owner(custodySigner.deriveAddress(ownerPath))
                .inputMint(mintAddress)
                .amount(intent.getSourceAmount())
                .recipient(quote.depositAddress())
                .build();
            PreparedTransaction transaction = ledgerGateway.prepare(transfer);
            List<byte[]> signatures = custodySigner.signAll(transaction.messageHex(), List.of(feePayerPath, ownerPath));
            return ledgerGateway.broadcast(transaction, signatures);
        });
        log.info("Bridge back for intent {} sent to {} in {} (withdraw {})", LogSanitizer.sanitize(intent.getIntentId()),
            LogSanitizer.maskIdentifier(quote.depositAddress()), bridgeTxId, withdrawTxId);
        return FlowResult.bridged(withdrawTxId, bridgeTxId, quote.depositAddress());
    }
}
