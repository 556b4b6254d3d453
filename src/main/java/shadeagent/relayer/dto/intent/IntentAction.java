package shadeagent.relayer.dto.intent;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Values of the {@code metadata.action} discriminator.
 * Lending actions need a market/mint pair in metadata.
 */
public enum IntentAction {
    SWAP("swap", false, false),
    KAMINO_DEPOSIT("kamino-deposit", true, false),
    KAMINO_WITHDRAW("kamino-withdraw", true, true);

    private final String wireValue;
    private final boolean lending;
    private final boolean withdrawalClass;

    IntentAction(String wireValue, boolean lending, boolean withdrawalClass) {
        this.wireValue = wireValue;
        this.lending = lending;
        this.withdrawalClass = withdrawalClass;
    }

    public String getWireValue() {
        return wireValue;
    }

    public boolean isLending() {
        return lending;
    }

    /**
     * Withdrawal-class actions move funds out of a user custody account and always
     * need a signature from the account owner.
     */
    public boolean isWithdrawalClass() {
        return withdrawalClass;
    }

    public static Optional<IntentAction> fromWireValue(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(a -> a.wireValue.equals(normalized))
            .findFirst();
    }
}
