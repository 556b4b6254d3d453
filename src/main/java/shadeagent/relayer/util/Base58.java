package shadeagent.relayer.util;

import java.math.BigInteger;
import java.util.Arrays;

/**
 * Base58 codec using the Bitcoin alphabet, as used by Solana addresses,
 * NEAR public keys and wallet signatures.
 */
public final class Base58 {

    private static final String ALPHABET = "123456789ABCDEFGHJKLMNPQRSTUVWXYZabcdefghijkmnopqrstuvwxyz";
    private static final BigInteger BASE = BigInteger.valueOf(58);
    private static final int[] INDEXES = new int[128];

    static {
        Arrays.fill(INDEXES, -1);
        for (int i = 0; i < ALPHABET.length(); i++) {
            INDEXES[ALPHABET.charAt(i)] = i;
        }
    }

    private Base58() {
    }

    public static String encode(byte[] input) {
        if (input == null || input.length == 0) {
            return "";
        }
        int leadingZeros = 0;
        while (leadingZeros < input.length && input[leadingZeros] == 0) {
            leadingZeros++;
        }
        StringBuilder sb = new StringBuilder();
        BigInteger value = new BigInteger(1, input);
        while (value.signum() > 0) {
            BigInteger[] divRem = value.divideAndRemainder(BASE);
            sb.append(ALPHABET.charAt(divRem[1].intValue()));
            value = divRem[0];
        }
        for (int i = 0; i < leadingZeros; i++) {
            sb.append(ALPHABET.charAt(0));
        }
        return sb.reverse().toString();
    }

    /**
     * @throws IllegalArgumentException if the input contains a character outside the alphabet
     */
    public static byte[] decode(String input) {
        if (input == null || input.isEmpty()) {
            return new byte[0];
        }
        BigInteger value = BigInteger.ZERO;
        int leadingZeros = 0;
        boolean counting = true;
        for (int i = 0; i < input.length(); i++) {
            char c = input.charAt(i);
            int digit = c < 128 ? INDEXES[c] : -1;
            if (digit < 0) {
                throw new IllegalArgumentException("Invalid base58 character '" + c + "' at position " + i);
            }
            if (counting && digit == 0) {
                leadingZeros++;
            } else {
                counting = false;
            }
            value = value.multiply(BASE).add(BigInteger.valueOf(digit));
        }
        byte[] magnitude = value.signum() == 0 ? new byte[0] : value.toByteArray();
        // BigInteger may prepend a sign byte
        int stripSign = magnitude.length > 1 && magnitude[0] == 0 ? 1 : 0;
        byte[] decoded = new byte[leadingZeros + magnitude.length - stripSign];
        System.arraycopy(magnitude, stripSign, decoded, leadingZeros, magnitude.length - stripSign);
        return decoded;
    }

    public static boolean isBase58(String input) {
        if (input == null || input.isEmpty()) {
            return false;
        }
        for (int i = 0; i < input.length(); i++) {
            char c = input.charAt(i);
            if (c >= 128 || INDEXES[c] < 0) {
                return false;
            }
        }
        return true;
    }
}
