package com.nevis.codeindex.parsing;

public final class TokenEstimator {

    private TokenEstimator() {
    }

    public static int estimate(CharSequence text) {
        long ascii = 0;
        long other = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) < 128) {
                ascii++;
            } else {
                other++;
            }
        }
        return tokens(ascii, other);
    }

    static int tokens(long asciiChars, long otherChars) {
        return (int) Math.min(Integer.MAX_VALUE, asciiChars / 4 + otherChars / 2);
    }
}
