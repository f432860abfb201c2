package com.lesson.dedup.detection;

import java.util.Locale;

/**
 * Title key for exact-title matching: surrounding whitespace removed, lowercased.
 * Inner whitespace and punctuation are kept, so "Garden  Basics" and "Garden Basics" differ.
 */
public final class TitleNormalizer {

    private TitleNormalizer() {
    }

    public static String normalize(String title) {
        if (title == null) {
            return "";
        }
        return title.strip().toLowerCase(Locale.ROOT);
    }

    public static boolean sameTitle(String a, String b) {
        String left = normalize(a);
        return !left.isEmpty() && left.equals(normalize(b));
    }
}
