package shadeagent.relayer.service.flow;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Serialized transaction message (hex) and the signer addresses in signature order.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PreparedTransaction(String messageHex, List<String> signers) {
}
