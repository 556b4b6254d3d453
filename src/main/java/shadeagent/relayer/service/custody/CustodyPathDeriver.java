package shadeagent.relayer.service.custody;

import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;
import shadeagent.relayer.config.RelayerProperties;

/**
 * Builds the derivation path that selects a custodied key. The base path alone is the
 * relayer's own fee-paying account; {@code basePath + "," + user} is the account isolated
 * for that user. Nothing is stored: the same user always yields the same path.
 */
@Component
@RequiredArgsConstructor
public class CustodyPathDeriver {

    public static final String SEPARATOR = ",";

    private final RelayerProperties properties;

    public static String derive(String basePath, String userIdentifier) {
        if (basePath == null || basePath.isBlank()) {
            throw new IllegalArgumentException("Derivation base path is required");
        }
        if (userIdentifier == null || userIdentifier.isBlank()) {
            return basePath;
        }
        if (userIdentifier.contains(SEPARATOR)) {
            throw new IllegalArgumentException("User identifier must not contain '" + SEPARATOR + "'");
        }
        return basePath + SEPARATOR + userIdentifier;
    }

    public String solanaSystemPath() {
        return derive(properties.getCustody().getSolanaBasePath(), null);
    }

    public String solanaUserPath(String userIdentifier) {
        if (userIdentifier == null || userIdentifier.isBlank()) {
            throw new IllegalArgumentException("User identifier is required for a user custody path");
        }
        return derive(properties.getCustody().getSolanaBasePath(), userIdentifier);
    }

    public String nearUserPath(String userIdentifier) {
        return derive(properties.getCustody().getNearBasePath(), userIdentifier);
    }
}
