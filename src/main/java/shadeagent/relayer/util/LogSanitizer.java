package shadeagent.relayer.util;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Utility helpers to make sure user controlled values are safe for logging.
 * Removes control characters to prevent log injection and masks account
 * identifiers (base58 addresses, NEAR public keys, deposit addresses).
 */
public final class LogSanitizer {

    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\r\\n\\t]+");
    private static final String ED25519_PREFIX = "ed25519:";
    private static final int MAX_LOGGED_LENGTH = 256;

    private LogSanitizer() {
        // Utility class
    }

    /**
     * Removes control characters and truncates very long remote payloads.
     *
     * @param value User or remote provided value
     * @return Sanitized value safe for log statements
     */
    public static String sanitize(String value) {
        if (value == null) {
            return "";
        }
        String cleaned = CONTROL_CHARS.matcher(value).replaceAll("_");
        if (cleaned.length() > MAX_LOGGED_LENGTH) {
            return cleaned.substring(0, MAX_LOGGED_LENGTH) + "...";
        }
        return cleaned;
    }

    /**
     * Masks an account identifier while keeping enough context for debugging.
     * A leading {@code ed25519:} key prefix is kept readable.
     *
     * @param identifier Address, public key or intent id
     * @return Short masked representation safe for logs
     */
    public static String maskIdentifier(String identifier) {
        String sanitized = sanitize(identifier);
        if (sanitized.isEmpty()) {
            return "";
        }
        String prefix = "";
        if (sanitized.startsWith(ED25519_PREFIX)) {
            prefix = ED25519_PREFIX;
            sanitized = sanitized.substring(ED25519_PREFIX.length());
        }
        if (sanitized.length() <= 4) {
            return prefix + (sanitized.isEmpty() ? "" : sanitized.charAt(0) + "***");
        }
        int prefixLength = Math.min(6, sanitized.length() / 2);
        int suffixLength = Math.min(4, Math.max(1, sanitized.length() - prefixLength));
        return prefix + sanitized.substring(0, prefixLength) + "..." + sanitized.substring(sanitized.length() - suffixLength);
    }

    public static String sanitizeOrDefault(String value, String defaultValue) {
        if (value == null) {
            return Objects.requireNonNullElse(defaultValue, "");
        }
        return sanitize(value);
    }
}
