package com.runeforge.rules.runtime.processor;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Display labels generated for elements that carry none.
 */
final class Labels {

    private Labels() {
    }

    /**
     * {@code "low-light-vision"} to {@code "Low Light Vision"}.
     */
    static String titleCase(String slug) {
        return Arrays.stream(slug.split("-"))
                .map(word -> word.isEmpty() ? word : Character.toUpperCase(word.charAt(0)) + word.substring(1))
                .collect(Collectors.joining(" "));
    }

    static String signed(int value) {
        return value >= 0 ? "+" + value : Integer.toString(value);
    }

    static boolean isBlank(String text) {
        return text == null || text.isBlank();
    }
}
