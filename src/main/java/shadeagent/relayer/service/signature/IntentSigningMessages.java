package shadeagent.relayer.service.signature;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import shadeagent.relayer.dto.intent.ValidatedIntent;

/**
 * Canonical messages a wallet signs to authorize one specific intent.
 * <p>
 * The NEAR and Solana variants are kept as separate strategies: the NEAR hash is
 * wrapped in a NEP-413 envelope by the wallet, while Solana wallets sign the hex
 * string bytes directly.
 */
public final class IntentSigningMessages {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private IntentSigningMessages() {
    }

    /**
     * SHA-256 hex of {@code {intentId, sourceAmount, destinationAmount, finalAsset, userDestination, action}}
     * for NEAR signers. Absent fields are omitted from the JSON.
     */
    public static String createIntentSigningMessage(ValidatedIntent intent) {
        return sha256Hex(canonicalJson(intent));
    }

    /**
     * Solana variant of {@link #createIntentSigningMessage(ValidatedIntent)}.
     */
    public static String createSolanaIntentSigningMessage(ValidatedIntent intent) {
        return sha256Hex(canonicalJson(intent));
    }

    static String canonicalJson(ValidatedIntent intent) {
        Map<String, Object> fields = new LinkedHashMap<>();
        putIfPresent(fields, "intentId", intent.getIntentId());
        putIfPresent(fields, "sourceAmount", intent.getSourceAmount());
        putIfPresent(fields, "destinationAmount", intent.getDestinationAmount());
        putIfPresent(fields, "finalAsset", intent.getFinalAsset());
        putIfPresent(fields, "userDestination", intent.getUserDestination());
        putIfPresent(fields, "action", intent.actionName());
        try {
            return MAPPER.writeValueAsString(fields);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize signing message", e);
        }
    }

    private static String sha256Hex(String value) {
        return Numeric.toHexStringNoPrefix(Hash.sha256(value.getBytes(StandardCharsets.UTF_8)));
    }

    private static void putIfPresent(Map<String, Object> fields, String key, String value) {
        if (value != null) {
            fields.put(key, value);
        }
    }
}
