package shadeagent.relayer.util;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.List;
import java.util.regex.Pattern;

import org.web3j.utils.Numeric;

/**
 * Decoding rules for wallet supplied Ed25519 material. Signatures may arrive as
 * base58, base64 or hex (with or without {@code 0x}); candidates are tried in
 * that order and must decode to exactly 64 bytes.
 */
public final class SignatureEncoding {

    public static final int SIGNATURE_LENGTH = 64;
    public static final int PUBLIC_KEY_LENGTH = 32;
    public static final String ED25519_PREFIX = "ed25519:";

    private static final Pattern BASE64 = Pattern.compile("^[A-Za-z0-9+/]+={0,2}$");
    private static final Pattern HEX = Pattern.compile("^(0x)?[0-9a-fA-F]+$");

    private SignatureEncoding() {
    }

    /**
     * @throws IllegalArgumentException when no encoding yields 64 bytes, or when two
     *         encodings yield different 64-byte values
     */
    public static byte[] decodeSignature(String encoded) {
        if (encoded == null || encoded.isBlank()) {
            throw new IllegalArgumentException("Signature is empty");
        }
        String value = encoded.trim();
        List<byte[]> candidates = new ArrayList<>();
        List<String> attempts = new ArrayList<>();

        if (Base58.isBase58(value)) {
            byte[] decoded = Base58.decode(value);
            attempts.add("base58=" + decoded.length + " bytes");
            if (decoded.length == SIGNATURE_LENGTH) {
                candidates.add(decoded);
            }
        }
        if (value.length() % 4 == 0 && BASE64.matcher(value).matches()) {
            byte[] decoded = Base64.getDecoder().decode(value);
            attempts.add("base64=" + decoded.length + " bytes");
            if (decoded.length == SIGNATURE_LENGTH) {
                candidates.add(decoded);
            }
        }
        if (HEX.matcher(value).matches() && Numeric.cleanHexPrefix(value).length() % 2 == 0) {
            byte[] decoded = Numeric.hexStringToByteArray(value);
            attempts.add("hex=" + decoded.length + " bytes");
            if (decoded.length == SIGNATURE_LENGTH) {
                candidates.add(decoded);
            }
        }

        if (candidates.isEmpty()) {
            throw new IllegalArgumentException("Signature must decode to " + SIGNATURE_LENGTH
                + " bytes as base58, base64 or hex" + (attempts.isEmpty() ? "" : " (got " + String.join(", ", attempts) + ")"));
        }
        byte[] first = candidates.get(0);
        for (byte[] other : candidates.subList(1, candidates.size())) {
            if (!Arrays.equals(first, other)) {
                throw new IllegalArgumentException("Signature encoding is ambiguous: several encodings decode to "
                    + SIGNATURE_LENGTH + " different bytes");
            }
        }
        return first;
    }

    /**
     * Decodes a 32-byte Ed25519 public key given either as raw base58 or as
     * {@code ed25519:<base58>}.
     */
    public static byte[] decodePublicKey(String encoded) {
        if (encoded == null || encoded.isBlank()) {
            throw new IllegalArgumentException("Public key is empty");
        }
        String raw = stripKeyPrefix(encoded.trim());
        if (!Base58.isBase58(raw)) {
            throw new IllegalArgumentException("Public key is not valid base58");
        }
        byte[] decoded = Base58.decode(raw);
        if (decoded.length != PUBLIC_KEY_LENGTH) {
            throw new IllegalArgumentException("Public key must be " + PUBLIC_KEY_LENGTH + " bytes, got " + decoded.length);
        }
        return decoded;
    }

    public static String stripKeyPrefix(String key) {
        if (key == null) {
            return null;
        }
        return key.startsWith(ED25519_PREFIX) ? key.substring(ED25519_PREFIX.length()) : key;
    }

    public static String toNearKey(String key) {
        if (key == null) {
            return null;
        }
        return key.startsWith(ED25519_PREFIX) ? key : ED25519_PREFIX + key;
    }
}
