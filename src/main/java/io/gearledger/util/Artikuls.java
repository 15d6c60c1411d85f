package io.gearledger.util;

import java.util.Locale;

/**
 * Part-code matching keys. Two artikuls refer to the same part when their
 * normalized forms are equal.
 */
public final class Artikuls {
    private Artikuls() {
    }

    public static String normalize(String artikul) {
        if (artikul == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(artikul.length());
        for (int i = 0; i < artikul.length(); i++) {
            char ch = artikul.charAt(i);
            if (Character.isWhitespace(ch) || ch == '-' || ch == '.') {
                continue;
            }
            sb.append(ch);
        }
        return sb.toString().toUpperCase(Locale.ROOT);
    }

    public static String clientKey(String client) {
        return client == null ? "" : client.toUpperCase(Locale.ROOT);
    }
}
