package shadeagent.relayer.service.flow;

/**
 * Asset identifier helpers for Solana tokens.
 */
public final class SolanaAssets {

    public static final String SOL_NATIVE_MINT = "So11111111111111111111111111111111111111112";
    public static final String SOL_DEFUSE_ASSET_ID = "nep141:sol.omft.near";

    private static final String ONE_CLICK_SPL_PREFIX = "1cs_v1:sol:spl:";
    private static final String SOL_PREFIX = "sol:";

    private SolanaAssets() {
    }

    /**
     * Raw mint address from {@code 1cs_v1:sol:spl:<mint>[:decimals]}, {@code sol:<mint>}
     * or a bare mint. Unrecognized formats are returned unchanged.
     */
    public static String extractMintAddress(String assetId) {
        if (assetId == null || assetId.isEmpty()) {
            return assetId;
        }
        if (assetId.startsWith(ONE_CLICK_SPL_PREFIX)) {
            String[] parts = assetId.split(":");
            if (parts.length >= 4 && !parts[3].isEmpty()) {
                return parts[3];
            }
        }
        if (assetId.startsWith(SOL_PREFIX)) {
            return assetId.substring(SOL_PREFIX.length());
        }
        return assetId;
    }

    /**
     * Settlement-side asset id for a Solana mint.
     */
    public static String defuseAssetId(String mintAddress) {
        if (SOL_NATIVE_MINT.equals(mintAddress)) {
            return SOL_DEFUSE_ASSET_ID;
        }
        return "nep141:" + mintAddress + ".omft.near";
    }
}
