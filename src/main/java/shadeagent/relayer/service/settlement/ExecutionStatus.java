package shadeagent.relayer.service.settlement;

import java.util.Locale;

/**
 * Settlement status string as reported by the swap service.
 */
public record ExecutionStatus(String status) {

    public String normalized() {
        return status == null ? "" : status.trim().toLowerCase(Locale.ROOT);
    }
}
