package shadeagent.relayer.service.custody;

/**
 * Key-derivation and signing service holding the master key. Keys are addressed
 * only by derivation path.
 */
public interface ChainSignatureClient {

    /**
     * @return the signature as returned by the agent (base58, base64 or hex)
     */
    String requestSignature(String path, String payloadHex, KeyType keyType);

    /**
     * @return base58 public key of the Ed25519 account derived for {@code path}
     */
    String deriveAddress(String path);
}
