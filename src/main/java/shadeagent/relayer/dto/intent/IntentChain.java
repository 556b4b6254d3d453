package shadeagent.relayer.dto.intent;

import java.util.Arrays;
import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Fixed set of chains an intent may name as source or destination.
 */
public enum IntentChain {
    NEAR("near"),
    SOLANA("solana"),
    ETHEREUM("ethereum"),
    BASE("base"),
    ARBITRUM("arbitrum"),
    BITCOIN("bitcoin"),
    ZCASH("zcash");

    private final String wireValue;

    IntentChain(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }

    @JsonCreator
    public static IntentChain fromWireValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(c -> c.wireValue.equals(normalized))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unsupported chain: " + value));
    }
}
