package shadeagent.relayer.service.signature;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Locale;

import shadeagent.relayer.dto.intent.UserSignature;

/**
 * Supported signing schemes. Each variant rebuilds the exact bytes the wallet signed.
 */
public enum SignatureScheme {

    NEP413("nep413", true) {
        @Override
        public byte[] signedBytes(UserSignature signature) {
            return nep413Digest(signature);
        }
    },

    SOLANA_RAW("solana", false) {
        @Override
        public byte[] signedBytes(UserSignature signature) {
            String message = signature.getMessage();
            return (message == null ? "" : message).getBytes(StandardCharsets.UTF_8);
        }
    },

    /** Untagged NEAR payloads that still carry nonce and recipient. */
    LEGACY_NEAR("legacy", true) {
        @Override
        public byte[] signedBytes(UserSignature signature) {
            return nep413Digest(signature);
        }
    };

    private final String tag;
    private final boolean nearKeyFormat;

    SignatureScheme(String tag, boolean nearKeyFormat) {
        this.tag = tag;
        this.nearKeyFormat = nearKeyFormat;
    }

    public abstract byte[] signedBytes(UserSignature signature);

    public String getTag() {
        return tag;
    }

    /**
     * True when identities for this scheme are NEAR keys ({@code ed25519:<base58>}),
     * false for raw base58 Solana addresses.
     */
    public boolean usesNearKeyFormat() {
        return nearKeyFormat;
    }

    /**
     * Selects the scheme from an explicit type tag, falling back to the payload shape.
     */
    public static SignatureScheme resolve(UserSignature signature) {
        String type = signature.getType();
        if (type != null && !type.isBlank()) {
            String normalized = type.trim().toLowerCase(Locale.ROOT);
            if (normalized.equals(NEP413.tag)) {
                return NEP413;
            }
            if (normalized.equals(SOLANA_RAW.tag)) {
                return SOLANA_RAW;
            }
            throw new IllegalArgumentException("Unsupported signature type: " + type);
        }
        return signature.hasNonceAndRecipient() ? LEGACY_NEAR : SOLANA_RAW;
    }

    private static byte[] nep413Digest(UserSignature signature) {
        byte[] nonce;
        try {
            nonce = Base64.getDecoder().decode(signature.getNonce() == null ? "" : signature.getNonce().trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("NEP-413 nonce is not valid base64", e);
        }
        return Nep413Payload.hash(signature.getMessage(), nonce, signature.getRecipient(), signature.getCallbackUrl());
    }
}
