package shadeagent.relayer.util;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("LogSanitizer Tests")
class LogSanitizerTest {

    @Nested
    @DisplayName("sanitize Tests")
    class SanitizeTests {

        @Test
        @DisplayName("Should return empty string for null input")
        void shouldReturnEmptyForNull() {
            assertEquals("", LogSanitizer.sanitize(null));
        }

        @Test
        @DisplayName("Should collapse control characters into one underscore")
        void shouldCollapseControlChars() {
            assertEquals("a_b", LogSanitizer.sanitize("a\r\n\tb"));
        }

        @Test
        @DisplayName("Should handle log injection attempt")
        void shouldPreventLogInjection() {
            String sanitized = LogSanitizer.sanitize("intent-1\n[ERROR] forged line");
            assertFalse(sanitized.contains("\n"));
        }

        @Test
        @DisplayName("Should truncate oversized remote payloads")
        void shouldTruncateLongValues() {
            String sanitized = LogSanitizer.sanitize("x".repeat(1000));
            assertEquals(259, sanitized.length());
            assertTrue(sanitized.endsWith("..."));
        }
    }

    @Nested
    @DisplayName("maskIdentifier Tests")
    class MaskIdentifierTests {

        @Test
        @DisplayName("Should mask a Solana address")
        void shouldMaskAddress() {
            assertEquals("So1111...1112", LogSanitizer.maskIdentifier("So11111111111111111111111111111111111111112"));
        }

        @Test
        @DisplayName("Should keep the ed25519 prefix readable")
        void shouldKeepKeyPrefix() {
            String masked = LogSanitizer.maskIdentifier("ed25519:8fWZkJ3pQ5M9XvZ1");
            assertTrue(masked.startsWith("ed25519:8fWZkJ"));
            assertFalse(masked.contains("Q5M9"));
        }

        @Test
        @DisplayName("Should mask very short identifiers")
        void shouldMaskShortValues() {
            assertEquals("a***", LogSanitizer.maskIdentifier("abcd"));
            assertEquals("", LogSanitizer.maskIdentifier(null));
        }
    }

    @Test
    @DisplayName("sanitizeOrDefault should fall back for null")
    void sanitizeOrDefaultShouldFallBack() {
        assertEquals("n/a", LogSanitizer.sanitizeOrDefault(null, "n/a"));
        assertEquals("x_y", LogSanitizer.sanitizeOrDefault("x\ny", "n/a"));
    }
}
