package shadeagent.relayer.service.signature;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import shadeagent.relayer.dto.intent.UserSignature;

@DisplayName("SignatureScheme Tests")
class SignatureSchemeTest {

    @Test
    @DisplayName("Explicit type tag should win over payload shape")
    void typeTagShouldWin() {
        UserSignature tagged = UserSignature.builder().type("SOLANA").nonce("AAAA").recipient("r").build();
        assertEquals(SignatureScheme.SOLANA_RAW, SignatureScheme.resolve(tagged));
        assertEquals(SignatureScheme.NEP413, SignatureScheme.resolve(UserSignature.builder().type("nep413").build()));
    }

    @Test
    @DisplayName("Untagged payload with nonce and recipient should be legacy NEAR")
    void untaggedNearShapeShouldBeLegacy() {
        UserSignature legacy = UserSignature.builder().nonce("AAAA").recipient("relayer.near").build();
        assertEquals(SignatureScheme.LEGACY_NEAR, SignatureScheme.resolve(legacy));
        assertTrue(SignatureScheme.LEGACY_NEAR.usesNearKeyFormat());
    }

    @Test
    @DisplayName("Untagged payload without nonce should be Solana raw")
    void untaggedPlainShouldBeSolana() {
        assertEquals(SignatureScheme.SOLANA_RAW, SignatureScheme.resolve(UserSignature.builder().recipient("r").build()));
    }

    @Test
    @DisplayName("Unknown type tag should be rejected")
    void unknownTagShouldBeRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> SignatureScheme.resolve(UserSignature.builder().type("eip712").build()));
    }

    @Test
    @DisplayName("Solana raw scheme should sign the UTF-8 message bytes")
    void solanaShouldSignMessageBytes() {
        UserSignature signature = UserSignature.builder().message("abc").build();
        assertArrayEquals("abc".getBytes(StandardCharsets.UTF_8), SignatureScheme.SOLANA_RAW.signedBytes(signature));
    }

    @Test
    @DisplayName("NEP-413 scheme should reject a nonce that is not base64")
    void nep413ShouldRejectBadNonce() {
        UserSignature signature = UserSignature.builder().type("nep413").message("m").nonce("***").recipient("r").build();
        assertThrows(IllegalArgumentException.class, () -> SignatureScheme.NEP413.signedBytes(signature));
    }
}
