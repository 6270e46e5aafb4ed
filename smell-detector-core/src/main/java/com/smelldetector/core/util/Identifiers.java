package com.smelldetector.core.util;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * String helpers for source identifiers.
 */
public final class Identifiers {

    private static final Pattern CAMEL_BOUNDARY = Pattern.compile("([a-z])([A-Z])");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private Identifiers() {
        // Utility class
    }

    /**
     * Splits an identifier into lower-case words.
     *
     * <p>Underscores separate words, and a boundary is inserted before every upper-case letter
     * that follows a lower-case one. {@code get_user_name}, {@code getUserName} and
     * {@code get_userName} all give {@code [get, user, name]}.
     *
     * @param name identifier text
     * @return words in order, empty for a blank identifier
     */
    public static List<String> split(String name) {
        if (name == null) {
            return List.of();
        }
        String spaced = CAMEL_BOUNDARY.matcher(name.replace('_', ' ')).replaceAll("$1 $2");
        String trimmed = spaced.trim();
        if (trimmed.isEmpty()) {
            return List.of();
        }
        return Arrays.stream(WHITESPACE.split(trimmed.toLowerCase(Locale.ROOT))).toList();
    }
}
