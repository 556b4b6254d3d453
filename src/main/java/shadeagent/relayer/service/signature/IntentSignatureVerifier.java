package shadeagent.relayer.service.signature;

import org.bouncycastle.crypto.params.Ed25519PublicKeyParameters;
import org.bouncycastle.crypto.signers.Ed25519Signer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import lombok.extern.slf4j.Slf4j;
import shadeagent.relayer.dto.intent.UserSignature;
import shadeagent.relayer.util.Base58;
import shadeagent.relayer.util.LogSanitizer;
import shadeagent.relayer.util.SignatureEncoding;

/**
 * Verifies Ed25519 authorization proofs for NEAR (NEP-413 and legacy) and Solana wallets.
 */
@Component
@Slf4j
public class IntentSignatureVerifier {

    public static final String CHECK_IDENTITY = "identity";
    public static final String CHECK_MESSAGE = "message";
    public static final String CHECK_RECIPIENT = "recipient";
    public static final String CHECK_SIGNATURE = "signature";

    private final String expectedRecipient;

    public IntentSignatureVerifier(@Value("${relayer.signature.expected-recipient:}") String expectedRecipient) {
        this.expectedRecipient = expectedRecipient == null || expectedRecipient.isBlank() ? null : expectedRecipient.trim();
    }

    /**
     * Full check: identity, then message (when {@code expectedMessageHash} is given),
     * then the Ed25519 signature. Stops at the first failing check.
     */
    public SignatureVerificationResult validate(UserSignature signature, String expectedIdentity, String expectedMessageHash) {
        if (signature == null) {
            return SignatureVerificationResult.failed(null, CHECK_SIGNATURE, "Missing user signature");
        }
        SignatureScheme scheme;
        try {
            scheme = SignatureScheme.resolve(signature);
        } catch (IllegalArgumentException e) {
            return SignatureVerificationResult.failed(null, CHECK_SIGNATURE, e.getMessage());
        }

        if (!verifyIdentityMatch(signature, expectedIdentity)) {
            return SignatureVerificationResult.failed(scheme, CHECK_IDENTITY,
                "Public key mismatch. Expected " + expectedIdentity + ", got " + signature.getPublicKey());
        }
        if (expectedMessageHash != null && !expectedMessageHash.equals(signature.getMessage())) {
            return SignatureVerificationResult.failed(scheme, CHECK_MESSAGE,
                "Message mismatch. Signature does not authorize this intent");
        }
        if (scheme.usesNearKeyFormat() && expectedRecipient != null && !expectedRecipient.equals(signature.getRecipient())) {
            return SignatureVerificationResult.failed(scheme, CHECK_RECIPIENT,
                "Recipient mismatch. Expected " + expectedRecipient + ", got " + signature.getRecipient());
        }
        return verifySignature(signature, scheme);
    }

    /**
     * Cryptographic check only.
     */
    public SignatureVerificationResult verify(UserSignature signature) {
        try {
            return verifySignature(signature, SignatureScheme.resolve(signature));
        } catch (IllegalArgumentException e) {
            return SignatureVerificationResult.failed(null, CHECK_SIGNATURE, e.getMessage());
        }
    }

    /**
     * Compares the signature's public key with the expected identity after normalizing both:
     * {@code ed25519:<base58>} for NEAR schemes, canonical base58 for Solana. Case-sensitive.
     */
    public boolean verifyIdentityMatch(UserSignature signature, String expectedIdentity) {
        if (signature == null || signature.getPublicKey() == null || expectedIdentity == null) {
            return false;
        }
        SignatureScheme scheme;
        try {
            scheme = SignatureScheme.resolve(signature);
        } catch (IllegalArgumentException e) {
            return false;
        }
        if (scheme.usesNearKeyFormat()) {
            return SignatureEncoding.toNearKey(signature.getPublicKey().trim())
                .equals(SignatureEncoding.toNearKey(expectedIdentity.trim()));
        }
        try {
            String declared = Base58.encode(SignatureEncoding.decodePublicKey(signature.getPublicKey()));
            String expected = Base58.encode(SignatureEncoding.decodePublicKey(expectedIdentity));
            return declared.equals(expected);
        } catch (IllegalArgumentException e) {
            log.debug("Identity comparison failed for {}: {}", LogSanitizer.maskIdentifier(expectedIdentity), e.getMessage());
            return false;
        }
    }

    private SignatureVerificationResult verifySignature(UserSignature signature, SignatureScheme scheme) {
        try {
            byte[] publicKey = SignatureEncoding.decodePublicKey(signature.getPublicKey());
            byte[] signatureBytes = SignatureEncoding.decodeSignature(signature.getSignature());
            byte[] signed = scheme.signedBytes(signature);

            Ed25519Signer verifier = new Ed25519Signer();
            verifier.init(false, new Ed25519PublicKeyParameters(publicKey, 0));
            verifier.update(signed, 0, signed.length);
            if (!verifier.verifySignature(signatureBytes)) {
                return SignatureVerificationResult.failed(scheme, CHECK_SIGNATURE, "Invalid signature");
            }
            return SignatureVerificationResult.ok(scheme);
        } catch (IllegalArgumentException e) {
            log.warn("Failed to verify {} signature from {}: {}", scheme.getTag(),
                LogSanitizer.maskIdentifier(signature.getPublicKey()), LogSanitizer.sanitize(e.getMessage()));
            return SignatureVerificationResult.failed(scheme, CHECK_SIGNATURE, e.getMessage());
        }
    }
}
