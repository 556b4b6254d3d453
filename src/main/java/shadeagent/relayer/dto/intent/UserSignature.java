package shadeagent.relayer.dto.intent;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Authorization proof attached to an intent. NEAR wallets send a NEP-413 shape
 * (nonce and recipient present), Solana wallets sign the raw message.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UserSignature {

    /** Optional scheme tag: {@code nep413} or {@code solana}. */
    private String type;

    @Size(max = 8192, message = "Signed message is too long")
    private String message;

    /** 64-byte Ed25519 signature as base58, base64 or hex. */
    private String signature;

    /** {@code ed25519:<base58>} for NEAR, raw base58 address for Solana. */
    private String publicKey;

    /** NEP-413 nonce, base64 of 32 bytes. */
    private String nonce;

    private String recipient;

    private String callbackUrl;

    @JsonIgnore
    public boolean hasNonceAndRecipient() {
        return nonce != null && !nonce.isBlank() && recipient != null && !recipient.isBlank();
    }

    @JsonIgnore
    public boolean isNearShaped() {
        return (nonce != null && !nonce.isBlank()) || (recipient != null && !recipient.isBlank());
    }
}
