package shadeagent.relayer.service.flow;

import java.util.List;

import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import shadeagent.relayer.config.RelayerProperties;
import shadeagent.relayer.dto.intent.IntentAction;
import shadeagent.relayer.dto.intent.ValidatedIntent;
import shadeagent.relayer.service.custody.CustodyPathDeriver;
import shadeagent.relayer.service.custody.CustodySigner;
import shadeagent.relayer.util.LogSanitizer;

/**
 * Supplies funds to a lending market from the user's custody account.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ProtocolDepositFlow implements ExecutionFlow {

    static final String USE_INTENTS = "useIntents";

    private final RelayerProperties properties;
    private final CustodyPathDeriver pathDeriver;
    private final CustodySigner custodySigner;
    private final LedgerGateway ledgerGateway;

    @Override
    public String name() {
        return "protocol-deposit";
    }

    @Override
    public boolean supports(ValidatedIntent intent) {
        return IntentAction.KAMINO_DEPOSIT.getWireValue().equals(intent.actionName())
            && intent.metadataString("marketAddress") != null
            && intent.metadataString("mintAddress") != null;
    }

    @Override
    public FlowResult execute(ValidatedIntent intent) {
        if (properties.isDryRun()) {
            return FlowResult.completed("dry-run-kamino-" + intent.getIntentId());
        }
        if (intent.metadataFlag(USE_INTENTS) && !intent.externallySettled() && intent.getDepositAddress() != null) {
            return intent.getOriginTxHash() == null
                ? FlowResult.awaitingDeposit(intent)
                : FlowResult.awaitingIntents(intent);
        }

        String ownerPath = pathDeriver.solanaUserPath(custodyIdentity(intent));
        String txId = custodySigner.withPathLocks(List.of(ownerPath), () -> {
            String owner = custodySigner.deriveAddress(ownerPath);
            TransactionRequest request = TransactionRequest.builder()
                .kind(TransactionKind.LENDING_DEPOSIT)
                .feePayer(owner)
                .owner(owner)
                .marketAddress(intent.metadataString("marketAddress"))
                .inputMint(intent.metadataString("mintAddress"))
                .amount(intent.getDestinationAmount() != null ? intent.getDestinationAmount() : intent.getSourceAmount())
                .build();
            PreparedTransaction transaction = ledgerGateway.prepare(request);
            return ledgerGateway.broadcast(transaction, custodySigner.signAll(transaction.messageHex(), List.of(ownerPath)));
        });
        log.info("Lending deposit for intent {} confirmed: {}", LogSanitizer.sanitize(intent.getIntentId()), txId);
        return FlowResult.completed(txId);
    }

    /**
     * Deposits are held under the depositor's NEAR key when one was given.
     */
    static String custodyIdentity(ValidatedIntent intent) {
        return intent.getNearPublicKey() != null ? intent.getNearPublicKey() : intent.getUserDestination();
    }
}
