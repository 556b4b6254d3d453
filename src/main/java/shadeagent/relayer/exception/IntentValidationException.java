package shadeagent.relayer.exception;

/**
 * Exception thrown when an intent is structurally invalid. Names the first
 * offending field.
 */
public class IntentValidationException extends RuntimeException {

    private final String field;

    public IntentValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
