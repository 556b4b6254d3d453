package shadeagent.relayer.dto.intent;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Structurally sound intent with defaults applied. Immutable; metadata changes
 * produce a copy.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ValidatedIntent {

    /** Metadata flag set once the external settlement leg has completed. */
    public static final String INTENTS_COMPLETED = "intentsCompleted";

    String intentId;
    IntentChain sourceChain;
    IntentChain destinationChain;
    String sourceAsset;
    String intermediateAsset;
    String finalAsset;
    String sourceAmount;
    String intermediateAmount;
    String destinationAmount;
    int slippageBps;
    String userDestination;
    String agentDestination;
    String nearPublicKey;
    String originTxHash;
    String depositAddress;
    String depositMemo;
    String refundAddress;
    Map<String, Object> metadata;
    UserSignature userSignature;

    /**
     * Raw {@code metadata.action} string, or null when absent.
     */
    public String actionName() {
        Object action = metadata == null ? null : metadata.get("action");
        return action == null ? null : action.toString();
    }

    /**
     * Action used for routing and authorization; unknown or missing values behave as a swap.
     */
    public IntentAction action() {
        return IntentAction.fromWireValue(actionName()).orElse(IntentAction.SWAP);
    }

    public String metadataString(String key) {
        Object value = metadata == null ? null : metadata.get(key);
        return value == null ? null : value.toString();
    }

    public boolean metadataFlag(String key) {
        Object value = metadata == null ? null : metadata.get(key);
        if (value instanceof Boolean b) {
            return b;
        }
        return value != null && Boolean.parseBoolean(value.toString());
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> metadataObject(String key) {
        Object value = metadata == null ? null : metadata.get(key);
        return value instanceof Map<?, ?> map ? (Map<String, Object>) map : null;
    }

    public boolean externallySettled() {
        return metadataFlag(INTENTS_COMPLETED);
    }

    public ValidatedIntent withMetadataValue(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (metadata != null) {
            copy.putAll(metadata);
        }
        copy.put(key, value);
        return toBuilder().metadata(Collections.unmodifiableMap(copy)).build();
    }
}
