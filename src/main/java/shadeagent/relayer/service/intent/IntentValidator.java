package shadeagent.relayer.service.intent;

import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;
import shadeagent.relayer.config.RelayerProperties;
import shadeagent.relayer.dto.intent.IntentAction;
import shadeagent.relayer.dto.intent.IntentChain;
import shadeagent.relayer.dto.intent.IntentMessage;
import shadeagent.relayer.dto.intent.ValidatedIntent;
import shadeagent.relayer.exception.IntentValidationException;
import shadeagent.relayer.service.custody.CustodyPathDeriver;
import shadeagent.relayer.service.flow.SolanaAssets;

/**
 * Structural validation of incoming intents. Does not check signatures.
 */
@Component
@RequiredArgsConstructor
public class IntentValidator {

    private static final Pattern UNSIGNED_INTEGER = Pattern.compile("^[0-9]+$");

    private final RelayerProperties properties;

    /**
     * @throws IntentValidationException naming the first offending field
     */
    public ValidatedIntent validate(IntentMessage raw) {
        if (raw == null) {
            throw new IntentValidationException("intent", "Intent payload is required");
        }
        requireText(raw.getIntentId(), "intentId");

        IntentChain served = properties.getServedChain();
        if (raw.getDestinationChain() != served) {
            throw new IntentValidationException("destinationChain",
                "Only " + served.getWireValue() + " destination is supported");
        }

        requireText(raw.getUserDestination(), "userDestination");
        requireCustodyIdentifier(raw.getUserDestination(), "userDestination");
        requireCustodyIdentifier(raw.getNearPublicKey(), "nearPublicKey");
        requireText(raw.getAgentDestination(), "agentDestination");
        requireText(raw.getSourceAsset(), "sourceAsset");
        requireText(raw.getFinalAsset(), "finalAsset");

        validateSourceAmount(raw.getSourceAmount());
        validateOptionalAmount(raw.getDestinationAmount(), "destinationAmount");
        validateOptionalAmount(raw.getIntermediateAmount(), "intermediateAmount");

        Map<String, Object> metadata = raw.getMetadata() == null ? Map.of() : raw.getMetadata();
        validateMetadata(metadata);

        Integer slippage = raw.getSlippageBps();
        if (slippage != null && (slippage < 0 || slippage > 10_000)) {
            throw new IntentValidationException("slippageBps", "slippageBps must be between 0 and 10000");
        }

        return ValidatedIntent.builder()
            .intentId(raw.getIntentId())
            .sourceChain(raw.getSourceChain())
            .destinationChain(raw.getDestinationChain())
            .sourceAsset(raw.getSourceAsset())
            .intermediateAsset(raw.getIntermediateAsset() != null ? raw.getIntermediateAsset() : defaultIntermediateAsset(served))
            .finalAsset(raw.getFinalAsset())
            .sourceAmount(raw.getSourceAmount())
            .intermediateAmount(raw.getIntermediateAmount())
            .destinationAmount(raw.getDestinationAmount())
            .slippageBps(slippage != null ? slippage : properties.getDefaultSlippageBps())
            .userDestination(raw.getUserDestination())
            .agentDestination(raw.getAgentDestination())
            .nearPublicKey(raw.getNearPublicKey())
            .originTxHash(raw.getOriginTxHash())
            .depositAddress(raw.getDepositAddress())
            .depositMemo(raw.getDepositMemo())
            .refundAddress(raw.getRefundAddress())
            .metadata(Collections.unmodifiableMap(new LinkedHashMap<>(metadata)))
            .userSignature(raw.getUserSignature())
            .build();
    }

    private void validateSourceAmount(String amount) {
        if (amount == null || !UNSIGNED_INTEGER.matcher(amount).matches()) {
            throw new IntentValidationException("sourceAmount", "sourceAmount must be a numeric string");
        }
        BigInteger value = new BigInteger(amount);
        if (value.signum() == 0) {
            throw new IntentValidationException("sourceAmount", "sourceAmount must be greater than zero");
        }
        if (value.compareTo(properties.getMaxSourceAmount()) >= 0) {
            throw new IntentValidationException("sourceAmount", "sourceAmount exceeds the maximum supported value");
        }
    }

    private void validateOptionalAmount(String amount, String field) {
        if (amount != null && !UNSIGNED_INTEGER.matcher(amount).matches()) {
            throw new IntentValidationException(field, field + " must be a numeric string");
        }
    }

    private void validateMetadata(Map<String, Object> metadata) {
        Object actionValue = metadata.get("action");
        IntentAction action = IntentAction.fromWireValue(actionValue == null ? null : actionValue.toString())
            .orElse(IntentAction.SWAP);
        if (!action.isLending()) {
            return;
        }
        requireMetadata(metadata, "marketAddress", action);
        requireMetadata(metadata, "mintAddress", action);

        Object bridgeBack = metadata.get("bridgeBack");
        if (bridgeBack == null) {
            return;
        }
        if (!(bridgeBack instanceof Map<?, ?> bridge)) {
            throw new IntentValidationException("metadata.bridgeBack", "bridgeBack must be an object");
        }
        for (String key : new String[] {"destinationChain", "destinationAddress", "destinationAsset"}) {
            Object value = bridge.get(key);
            if (value == null || value.toString().isBlank()) {
                throw new IntentValidationException("metadata.bridgeBack." + key, "bridgeBack requires " + key);
            }
        }
    }

    private void requireMetadata(Map<String, Object> metadata, String key, IntentAction action) {
        Object value = metadata.get(key);
        if (value == null || value.toString().isBlank()) {
            throw new IntentValidationException("metadata." + key, action.getWireValue() + " requires " + key);
        }
    }

    /**
     * Custody paths join the base path and the user identifier with a separator, so the
     * identifier itself must not contain it.
     */
    private static void requireCustodyIdentifier(String value, String field) {
        if (value != null && value.contains(CustodyPathDeriver.SEPARATOR)) {
            throw new IntentValidationException(field,
                field + " must not contain '" + CustodyPathDeriver.SEPARATOR + "'");
        }
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IntentValidationException(field, field + " is required");
        }
    }

    private static String defaultIntermediateAsset(IntentChain served) {
        return served == IntentChain.SOLANA ? SolanaAssets.SOL_NATIVE_MINT : null;
    }
}
