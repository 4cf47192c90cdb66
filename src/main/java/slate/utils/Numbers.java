package slate.utils;

import java.nio.charset.StandardCharsets;

public class Numbers {

    private Numbers() { }

    /**
     * Parses a signed decimal the way stored integers are written: an optional
     * leading '-', no '+', no whitespace and no leading zeros ("0" itself is
     * fine, "-0" is not).
     *
     * @throws NumberFormatException if the text is not in that form or does
     *         not fit in a long
     */
    public static long parseStrictLong(byte[] text) {
        int len = text.length;
        if (len == 0 || len > 20) throw invalid(text);
        if (len == 1 && text[0] == '0') return 0;

        int i = 0;
        boolean negative = false;
        if (text[0] == '-') {
            negative = true;
            i++;
            if (i == len) throw invalid(text);
        }
        if (text[i] < '1' || text[i] > '9') throw invalid(text);

        // Accumulate negatively so Long.MIN_VALUE is reachable.
        long limit = negative ? Long.MIN_VALUE : -Long.MAX_VALUE;
        long result = 0;
        for (; i < len; i++) {
            int digit = text[i] - '0';
            if (digit < 0 || digit > 9) throw invalid(text);
            if (result < limit / 10) throw invalid(text);
            result *= 10;
            if (result < limit + digit) throw invalid(text);
            result -= digit;
        }
        return negative ? result : -result;
    }

    private static NumberFormatException invalid(byte[] text) {
        return new NumberFormatException("not a strict decimal integer: " + new String(text, StandardCharsets.UTF_8));
    }
}
