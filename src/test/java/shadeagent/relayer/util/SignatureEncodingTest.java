package shadeagent.relayer.util;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Base64;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.web3j.utils.Numeric;

@DisplayName("SignatureEncoding Tests")
class SignatureEncodingTest {

    private static byte[] sampleSignature() {
        byte[] bytes = new byte[64];
        for (int i = 0; i < bytes.length; i++) {
            bytes[i] = (byte) (i * 7 + 3);
        }
        return bytes;
    }

    @Nested
    @DisplayName("decodeSignature Tests")
    class DecodeSignatureTests {

        @Test
        @DisplayName("Should accept base58 signatures")
        void shouldAcceptBase58() {
            byte[] sig = sampleSignature();
            assertArrayEquals(sig, SignatureEncoding.decodeSignature(Base58.encode(sig)));
        }

        @Test
        @DisplayName("Should accept base64 signatures")
        void shouldAcceptBase64() {
            byte[] sig = sampleSignature();
            assertArrayEquals(sig, SignatureEncoding.decodeSignature(Base64.getEncoder().encodeToString(sig)));
        }

        @Test
        @DisplayName("Should accept hex signatures with and without 0x")
        void shouldAcceptHex() {
            byte[] sig = sampleSignature();
            assertArrayEquals(sig, SignatureEncoding.decodeSignature(Numeric.toHexString(sig)));
            assertArrayEquals(sig, SignatureEncoding.decodeSignature(Numeric.toHexStringNoPrefix(sig)));
        }

        @Test
        @DisplayName("Should reject values that never decode to 64 bytes")
        void shouldRejectWrongLength() {
            IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> SignatureEncoding.decodeSignature(Base58.encode(new byte[] {1, 2, 3})));
            assertTrue(ex.getMessage().contains("64 bytes"));
        }

        @Test
        @DisplayName("Should reject blank input")
        void shouldRejectBlank() {
            assertThrows(IllegalArgumentException.class, () -> SignatureEncoding.decodeSignature(" "));
            assertThrows(IllegalArgumentException.class, () -> SignatureEncoding.decodeSignature(null));
        }
    }

    @Nested
    @DisplayName("decodePublicKey Tests")
    class DecodePublicKeyTests {

        @Test
        @DisplayName("Should accept prefixed and bare keys")
        void shouldAcceptPrefixedAndBareKeys() {
            byte[] key = new byte[32];
            key[0] = 9;
            key[31] = 1;
            String bare = Base58.encode(key);
            assertArrayEquals(key, SignatureEncoding.decodePublicKey(bare));
            assertArrayEquals(key, SignatureEncoding.decodePublicKey("ed25519:" + bare));
        }

        @Test
        @DisplayName("Should reject keys of the wrong size")
        void shouldRejectWrongSize() {
            assertThrows(IllegalArgumentException.class,
                () -> SignatureEncoding.decodePublicKey(Base58.encode(new byte[] {5, 6, 7})));
        }

        @Test
        @DisplayName("Should reject non-base58 keys")
        void shouldRejectNonBase58() {
            assertThrows(IllegalArgumentException.class, () -> SignatureEncoding.decodePublicKey("ed25519:0OIl"));
        }
    }

    @Test
    @DisplayName("toNearKey should add the prefix once")
    void toNearKeyShouldAddPrefixOnce() {
        assertEquals("ed25519:abc", SignatureEncoding.toNearKey("abc"));
        assertEquals("ed25519:abc", SignatureEncoding.toNearKey("ed25519:abc"));
        assertEquals("abc", SignatureEncoding.stripKeyPrefix("ed25519:abc"));
    }
}
