package com.ledgerly.backend.classification;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalizes a transaction description before vectorization: lowercase, merchant appended,
 * anything but ASCII letters and whitespace turned into spaces, whitespace runs collapsed.
 */
public final class TextPreprocessor {

    private static final Pattern NON_LETTER = Pattern.compile("[^a-zA-Z\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TextPreprocessor() {}

    public static String preprocess(String description, String merchantName) {
        String text = description == null ? "" : description.toLowerCase(Locale.ROOT);
        if (merchantName != null && !merchantName.isEmpty()) {
            text += " " + merchantName.toLowerCase(Locale.ROOT);
        }
        text = NON_LETTER.matcher(text).replaceAll(" ");
        return WHITESPACE.matcher(text.strip()).replaceAll(" ");
    }
}
