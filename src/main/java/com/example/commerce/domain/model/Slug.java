package com.example.commerce.domain.model;

import java.text.Normalizer;
import java.util.Locale;
import java.util.function.Predicate;

/**
 * URL-safe identifiers derived from display names.
 */
public final class Slug {

    private Slug() {
    }

    /**
     * Lower-cases the name and collapses every run of non-alphanumeric characters into one hyphen.
     */
    public static String of(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Name is required to derive a slug");
        }
        String ascii = Normalizer.normalize(name, Normalizer.Form.NFD).replaceAll("\\p{M}", "");
        String slug = ascii.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("(^-+)|(-+$)", "");
        return slug.isEmpty() ? "item" : slug;
    }

    /**
     * Derives a slug and appends {@code -2}, {@code -3} and so on until {@code taken} rejects it.
     */
    public static String unique(String name, Predicate<String> taken) {
        String base = of(name);
        String candidate = base;
        int suffix = 2;
        while (taken.test(candidate)) {
            candidate = base + "-" + suffix++;
        }
        return candidate;
    }
}
