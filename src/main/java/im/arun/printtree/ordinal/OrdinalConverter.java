package im.arun.printtree.ordinal;

/**
 * Converts 1-based sibling positions into the sequence values used by numbered list styles.
 */
public final class OrdinalConverter {

    /**
     * Returned by {@link #toAlpha(int)} and {@link #toRoman(int)} for non-positive input.
     */
    public static final String INVALID = "-";

    private static final int[] ROMAN_VALUES = {1000, 900, 500, 400, 100, 90, 50, 40, 10, 9, 5, 4, 1};
    private static final String[] ROMAN_SYMBOLS = {"m", "cm", "d", "cd", "c", "xc", "l", "xl", "x", "ix", "v", "iv", "i"};

    private OrdinalConverter() {
    }

    public static String toDecimal(int n) {
        return Integer.toString(n);
    }

    /**
     * Bijective base-26 using lower case letters, the way spreadsheet columns are named:
     * 1 -> a, 26 -> z, 27 -> aa, 702 -> zz, 703 -> aaa.
     */
    public static String toAlpha(int n) {
        if (n <= 0) {
            return INVALID;
        }

        StringBuilder sb = new StringBuilder();
        while (n > 0) {
            sb.append((char) ('a' + (n - 1) % 26));
            n = (n - 1) / 26;
        }
        return sb.reverse().toString();
    }

    /**
     * Lower case subtractive Roman numerals, built greedily. There is no upper bound, values past
     * 3999 simply repeat "m".
     */
    public static String toRoman(int n) {
        if (n <= 0) {
            return INVALID;
        }

        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < ROMAN_VALUES.length; i++) {
            while (n >= ROMAN_VALUES[i]) {
                sb.append(ROMAN_SYMBOLS[i]);
                n -= ROMAN_VALUES[i];
            }
        }
        return sb.toString();
    }
}
