package shadeagent.relayer.exception;

/**
 * Exception thrown when an intent lacks a valid authorization proof.
 * {@code check} names the verification step that failed.
 */
public class IntentAuthorizationException extends RuntimeException {

    private final String check;

    public IntentAuthorizationException(String check, String message) {
        super(message);
        this.check = check;
    }

    public String getCheck() {
        return check;
    }
}
