package shadeagent.relayer.dto.intent;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * Intent as received from a client or read back from the queue, before validation.
 * Amounts are unsigned integer strings in base units.
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class IntentMessage {
    @Size(max = 128, message = "intentId must be at most 128 characters")
    private String intentId;
    private IntentChain sourceChain;
    private IntentChain destinationChain;
    private String sourceAsset;
    private String intermediateAsset;
    private String finalAsset;
    private String sourceAmount;
    private String intermediateAmount;
    private String destinationAmount;
    private Integer slippageBps;
    @Size(max = 128, message = "userDestination must be at most 128 characters")
    private String userDestination;
    @Size(max = 128, message = "agentDestination must be at most 128 characters")
    private String agentDestination;
    private String nearPublicKey;
    private String originTxHash;
    private String depositAddress;
    private String depositMemo;
    private String refundAddress;
    private Map<String, Object> metadata;
    @Valid
    private UserSignature userSignature;
}
