package shadeagent.relayer.service.signature;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

import org.web3j.crypto.Hash;

/**
 * Borsh layout of a NEP-413 signed message:
 * {@code u32 tag | string message | [u8; 32] nonce | string recipient | Option<string> callbackUrl},
 * all integers little-endian, strings as u32 length followed by UTF-8 bytes.
 */
public final class Nep413Payload {

    /** 2^31 + 413. */
    public static final long TAG = (1L << 31) + 413;
    public static final int NONCE_LENGTH = 32;

    private Nep413Payload() {
    }

    public static byte[] serialize(String message, byte[] nonce, String recipient, String callbackUrl) {
        if (nonce == null || nonce.length != NONCE_LENGTH) {
            throw new IllegalArgumentException("NEP-413 nonce must be " + NONCE_LENGTH + " bytes, got "
                + (nonce == null ? 0 : nonce.length));
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        writeU32(out, TAG);
        writeString(out, message == null ? "" : message);
        out.writeBytes(nonce);
        writeString(out, recipient == null ? "" : recipient);
        if (callbackUrl == null) {
            out.write(0);
        } else {
            out.write(1);
            writeString(out, callbackUrl);
        }
        return out.toByteArray();
    }

    /**
     * SHA-256 of the Borsh payload; this digest is what the wallet signs.
     */
    public static byte[] hash(String message, byte[] nonce, String recipient, String callbackUrl) {
        return Hash.sha256(serialize(message, nonce, recipient, callbackUrl));
    }

    private static void writeU32(ByteArrayOutputStream out, long value) {
        out.writeBytes(ByteBuffer.allocate(4).order(ByteOrder.LITTLE_ENDIAN).putInt((int) value).array());
    }

    private static void writeString(ByteArrayOutputStream out, String value) {
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        writeU32(out, bytes.length);
        out.writeBytes(bytes);
    }
}
