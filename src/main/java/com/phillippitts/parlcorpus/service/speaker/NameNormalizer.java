package com.phillippitts.parlcorpus.service.speaker;

import java.text.Normalizer;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Normalizes person names for lookup.
 *
 * <p>Decomposes and strips diacritics, lower-cases, turns punctuation other than the initial
 * dot into spaces, collapses whitespace and removes leading title words. {@code "Puhemies
 * Matti Vanhanen"} and {@code "matti  VANHANEN"} both become {@code "matti vanhanen"}.
 */
public final class NameNormalizer {

    private final List<String> titles;

    /**
     * @param titlePrefixes title words or phrases to strip, longest match first
     */
    public NameNormalizer(List<String> titlePrefixes) {
        this.titles = titlePrefixes.stream()
                .map(NameNormalizer::basic)
                .filter(t -> !t.isEmpty())
                .sorted(Comparator.comparingInt(String::length).reversed())
                .toList();
    }

    /**
     * Normalized name with titles removed; empty for null or blank input.
     */
    public String normalize(String name) {
        String n = basic(name);
        boolean stripped = true;
        while (stripped && !n.isEmpty()) {
            stripped = false;
            for (String title : titles) {
                if (n.equals(title)) {
                    return "";
                }
                if (n.startsWith(title + " ")) {
                    n = n.substring(title.length() + 1);
                    stripped = true;
                    break;
                }
            }
        }
        return n;
    }

    /**
     * Lookup key without initial dots.
     */
    public String key(String name) {
        return normalize(name).replace(".", "").replaceAll(" +", " ").trim();
    }

    static String basic(String name) {
        if (name == null || name.isBlank()) {
            return "";
        }
        String decomposed = Normalizer.normalize(name, Normalizer.Form.NFD).replaceAll("\\p{M}+", "");
        StringBuilder sb = new StringBuilder(decomposed.length());
        decomposed.toLowerCase(Locale.ROOT).codePoints().forEach(cp -> {
            if (Character.isLetter(cp) || cp == '.') {
                sb.appendCodePoint(cp);
            } else {
                sb.append(' ');
            }
        });
        return sb.toString().trim().replaceAll(" +", " ");
    }
}
