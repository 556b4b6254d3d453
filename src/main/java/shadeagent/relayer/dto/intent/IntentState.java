package shadeagent.relayer.dto.intent;

import java.util.Arrays;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum IntentState {
    PENDING("pending", false),
    PROCESSING("processing", false),
    AWAITING_DEPOSIT("awaiting_deposit", false),
    AWAITING_INTENTS("awaiting_intents", false),
    SUCCEEDED("succeeded", true),
    FAILED("failed", true);

    private final String wireValue;
    private final boolean terminal;

    IntentState(String wireValue, boolean terminal) {
        this.wireValue = wireValue;
        this.terminal = terminal;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }

    public boolean isTerminal() {
        return terminal;
    }

    public boolean isAwaiting() {
        return this == AWAITING_DEPOSIT || this == AWAITING_INTENTS;
    }

    @JsonCreator
    public static IntentState fromWireValue(String value) {
        return Arrays.stream(values())
            .filter(s -> s.wireValue.equals(value))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown intent state: " + value));
    }
}
