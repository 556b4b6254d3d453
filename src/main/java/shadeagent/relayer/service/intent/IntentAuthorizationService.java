package shadeagent.relayer.service.intent;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import lombok.extern.slf4j.Slf4j;
import shadeagent.relayer.dto.intent.IntentAction;
import shadeagent.relayer.dto.intent.UserSignature;
import shadeagent.relayer.dto.intent.ValidatedIntent;
import shadeagent.relayer.exception.IntentAuthorizationException;
import shadeagent.relayer.service.signature.IntentSignatureVerifier;
import shadeagent.relayer.service.signature.IntentSigningMessages;
import shadeagent.relayer.service.signature.SignatureScheme;
import shadeagent.relayer.service.signature.SignatureVerificationResult;
import shadeagent.relayer.util.LogSanitizer;

/**
 * Decides whether an intent carries enough proof to be executed.
 * <ul>
 *   <li>Withdrawal-class actions need a Solana signature from {@code userDestination}.</li>
 *   <li>Deposit-class actions need a deposit proof or a valid signature; a signature that is
 *       present is always checked.</li>
 * </ul>
 */
@Service
@Slf4j
public class IntentAuthorizationService {

    public static final String CHECK_PROOF = "proof";
    public static final String CHECK_SCHEME = "scheme";

    private final IntentSignatureVerifier signatureVerifier;
    private final boolean requireMessageMatch;

    public IntentAuthorizationService(
        IntentSignatureVerifier signatureVerifier,
        @Value("${relayer.signature.require-message-match:true}") boolean requireMessageMatch
    ) {
        this.signatureVerifier = signatureVerifier;
        this.requireMessageMatch = requireMessageMatch;
    }

    /**
     * @throws IntentAuthorizationException when the intent may not run
     */
    public void authorize(ValidatedIntent intent) {
        IntentAction action = intent.action();
        UserSignature signature = intent.getUserSignature();

        if (action.isWithdrawalClass()) {
            authorizeWithdrawal(intent, action, signature);
            return;
        }
        if (signature != null) {
            checkSignature(intent, signature);
            return;
        }
        if (!hasDepositProof(intent)) {
            throw new IntentAuthorizationException(CHECK_PROOF,
                action.getWireValue() + " requires a deposit proof or a user signature");
        }
    }

    private void authorizeWithdrawal(ValidatedIntent intent, IntentAction action, UserSignature signature) {
        if (signature == null) {
            throw new IntentAuthorizationException(CHECK_PROOF, action.getWireValue() + " requires userSignature for authorization");
        }
        if (signature.isNearShaped() || resolveScheme(signature) != SignatureScheme.SOLANA_RAW) {
            throw new IntentAuthorizationException(CHECK_SCHEME,
                action.getWireValue() + " requires a Solana signature, not a NEAR signature");
        }
        String expectedMessage = requireMessageMatch ? IntentSigningMessages.createSolanaIntentSigningMessage(intent) : null;
        reject(intent, signatureVerifier.validate(signature, intent.getUserDestination(), expectedMessage));
    }

    private void checkSignature(ValidatedIntent intent, UserSignature signature) {
        if (resolveScheme(signature).usesNearKeyFormat()) {
            if (intent.getNearPublicKey() == null || intent.getNearPublicKey().isBlank()) {
                throw new IntentAuthorizationException(CHECK_PROOF, "NEAR signatures require nearPublicKey to identify the user");
            }
            String expectedMessage = requireMessageMatch ? IntentSigningMessages.createIntentSigningMessage(intent) : null;
            reject(intent, signatureVerifier.validate(signature, intent.getNearPublicKey(), expectedMessage));
        } else {
            String expectedMessage = requireMessageMatch ? IntentSigningMessages.createSolanaIntentSigningMessage(intent) : null;
            reject(intent, signatureVerifier.validate(signature, intent.getUserDestination(), expectedMessage));
        }
    }

    private static SignatureScheme resolveScheme(UserSignature signature) {
        try {
            return SignatureScheme.resolve(signature);
        } catch (IllegalArgumentException e) {
            throw new IntentAuthorizationException(CHECK_SCHEME, e.getMessage());
        }
    }

    private void reject(ValidatedIntent intent, SignatureVerificationResult result) {
        if (result.valid()) {
            return;
        }
        log.warn("Authorization failed for intent {} [{}]: {}", LogSanitizer.sanitize(intent.getIntentId()),
            result.failedCheck(), LogSanitizer.sanitize(result.error()));
        throw new IntentAuthorizationException(result.failedCheck(), "Authorization failed: " + result.error());
    }

    private static boolean hasDepositProof(ValidatedIntent intent) {
        return intent.getDepositAddress() != null && !intent.getDepositAddress().isBlank();
    }
}
