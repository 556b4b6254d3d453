package shadeagent.relayer.service.custody;

/**
 * Curve requested from the chain-signature agent.
 */
public enum KeyType {
    EDDSA("Eddsa"),
    ECDSA("Ecdsa");

    private final String wireValue;

    KeyType(String wireValue) {
        this.wireValue = wireValue;
    }

    public String getWireValue() {
        return wireValue;
    }
}
