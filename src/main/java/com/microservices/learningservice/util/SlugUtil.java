package com.microservices.learningservice.util;

import java.text.Normalizer;
import java.util.Locale;
import java.util.function.Predicate;
import java.util.regex.Pattern;

public final class SlugUtil {

    private static final Pattern DIACRITICS = Pattern.compile("\\p{M}+");
    private static final Pattern NON_WORD = Pattern.compile("[^\\w\\s-]");
    private static final Pattern SEPARATORS = Pattern.compile("[-\\s]+");
    private static final String FALLBACK = "course";

    private SlugUtil() {
    }

    /**
     * "Intro to Python!" becomes "intro-to-python". Non-ASCII letters are folded to ASCII
     * where possible and dropped otherwise.
     */
    public static String slugify(String value) {
        if (value == null) {
            return "";
        }
        String ascii = DIACRITICS.matcher(Normalizer.normalize(value, Normalizer.Form.NFKD)).replaceAll("");
        ascii = ascii.replaceAll("[^\\p{ASCII}]", "");
        String cleaned = NON_WORD.matcher(ascii.toLowerCase(Locale.ROOT)).replaceAll("").trim();
        String slug = SEPARATORS.matcher(cleaned).replaceAll("-");
        return stripEdges(slug);
    }

    /**
     * Slug of {@code title}, suffixed "-1", "-2", ... until {@code taken} rejects it.
     */
    public static String uniqueSlug(String title, int maxLength, Predicate<String> taken) {
        String base = slugify(title);
        if (base.isEmpty()) {
            base = FALLBACK;
        }
        // leave room for a numeric suffix
        if (base.length() > maxLength - 10) {
            base = stripEdges(base.substring(0, maxLength - 10));
        }
        String candidate = base;
        int counter = 1;
        while (taken.test(candidate)) {
            candidate = base + "-" + counter;
            counter++;
        }
        return candidate;
    }

    private static String stripEdges(String slug) {
        int start = 0;
        int end = slug.length();
        while (start < end && (slug.charAt(start) == '-' || slug.charAt(start) == '_')) {
            start++;
        }
        while (end > start && (slug.charAt(end - 1) == '-' || slug.charAt(end - 1) == '_')) {
            end--;
        }
        return slug.substring(start, end);
    }
}
