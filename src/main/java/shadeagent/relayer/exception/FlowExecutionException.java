package shadeagent.relayer.exception;

/**
 * Exception thrown when a step of an execution flow fails (chain RPC, signing,
 * quote). Recovered by the retry loop up to the attempt cap.
 */
public class FlowExecutionException extends RuntimeException {

    private final String step;

    public FlowExecutionException(String step, String message) {
        super(message);
        this.step = step;
    }

    public FlowExecutionException(String step, String message, Throwable cause) {
        super(message, cause);
        this.step = step;
    }

    public String getStep() {
        return step;
    }
}
