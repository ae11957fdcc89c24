package com.delta.opportunities.pipeline.util;

import org.jsoup.Jsoup;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

public final class TextNormalizer {
    private static final Pattern DIACRITICS = Pattern.compile("\\p{M}+");
    private static final Pattern NON_ALNUM = Pattern.compile("[^\\p{L}\\p{N}]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TextNormalizer() {
    }

    /**
     * Lower-cased, accent-free, punctuation-free text with single spaces.
     */
    public static String normalize(String value) {
        if (value == null || value.isBlank()) {
            return "";
        }
        String decomposed = Normalizer.normalize(value, Normalizer.Form.NFD);
        String stripped = DIACRITICS.matcher(decomposed).replaceAll("");
        String lettersOnly = NON_ALNUM.matcher(stripped.toLowerCase(Locale.ROOT)).replaceAll(" ");
        return WHITESPACE.matcher(lettersOnly).replaceAll(" ").trim();
    }

    public static List<String> tokens(String value) {
        String normalized = normalize(value);
        if (normalized.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(normalized.split(" "));
    }

    /**
     * Word shingles of the given size over the normalized text. Texts shorter than the
     * shingle size yield a single shingle of the whole text.
     */
    public static List<String> shingles(String value, int size) {
        List<String> words = tokens(value);
        if (words.isEmpty()) {
            return List.of();
        }
        if (words.size() <= size) {
            return List.of(String.join(" ", words));
        }
        List<String> out = new ArrayList<>(words.size() - size + 1);
        for (int i = 0; i + size <= words.size(); i++) {
            out.add(String.join(" ", words.subList(i, i + size)));
        }
        return out;
    }

    /**
     * Plain text of a scraped description, which frequently arrives as HTML.
     */
    public static String stripHtml(String value) {
        if (value == null || value.isBlank()) {
            return value;
        }
        if (value.indexOf('<') < 0) {
            return value.trim();
        }
        return Jsoup.parse(value).text().trim();
    }

    public static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
