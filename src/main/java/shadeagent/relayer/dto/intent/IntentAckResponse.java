package shadeagent.relayer.dto.intent;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class IntentAckResponse {
    private String intentId;
    private String state;
    private String reason;
    private String receivedAt;

    public IntentAckResponse() {
    }

    public IntentAckResponse(String intentId, String state, String reason, String receivedAt) {
        this.intentId = intentId;
        this.state = state;
        this.reason = reason;
        this.receivedAt = receivedAt;
    }

    public String getIntentId() {
        return intentId;
    }

    public void setIntentId(String intentId) {
        this.intentId = intentId;
    }

    public String getState() {
        return state;
    }

    public void setState(String state) {
        this.state = state;
    }

    public String getReason() {
        return reason;
    }

    public void setReason(String reason) {
        this.reason = reason;
    }

    public String getReceivedAt() {
        return receivedAt;
    }

    public void setReceivedAt(String receivedAt) {
        this.receivedAt = receivedAt;
    }
}
