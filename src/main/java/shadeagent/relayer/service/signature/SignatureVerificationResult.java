package shadeagent.relayer.service.signature;

/**
 * Outcome of a signature check. {@code failedCheck} is one of
 * {@code identity}, {@code message}, {@code recipient}, {@code signature}.
 */
public record SignatureVerificationResult(
    boolean valid,
    SignatureScheme scheme,
    String failedCheck,
    String error
) {

    public static SignatureVerificationResult ok(SignatureScheme scheme) {
        return new SignatureVerificationResult(true, scheme, null, null);
    }

    public static SignatureVerificationResult failed(SignatureScheme scheme, String check, String error) {
        return new SignatureVerificationResult(false, scheme, check, error);
    }
}
