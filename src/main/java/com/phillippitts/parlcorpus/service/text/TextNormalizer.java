package com.phillippitts.parlcorpus.service.text;

import com.phillippitts.parlcorpus.config.properties.NormalizationProperties;

import java.text.Normalizer;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Converts raw transcript text into the corpus's canonical orthographic form.
 *
 * <p>Rules, in order:
 * <ol>
 *   <li>Unicode NFC composition</li>
 *   <li>lower-casing</li>
 *   <li>number expansion (when enabled)</li>
 *   <li>configured character translations, in their configured order</li>
 *   <li>every character that is not a letter becomes a space</li>
 *   <li>whitespace collapsed to single spaces and trimmed</li>
 * </ol>
 * The last three steps repeat until the text stops changing, because a replacement can combine
 * with the following text into another key (translating {@code ab} to {@code c} and {@code x}
 * to {@code a} turns {@code xb} into {@code ab} and then into {@code c}).
 *
 * <p>The result contains only lower-case letters and single spaces and no translation key, so
 * normalizing it again returns it unchanged. Instances are immutable and safe to share between
 * sessions.
 */
public class TextNormalizer {

    /** Bound on translate-and-clean passes over one text. */
    static final int MAX_PASSES = 16;

    private final boolean expandNumbers;
    private final Map<String, String> translations;

    public TextNormalizer(NormalizationProperties properties) {
        this(properties.isExpandNumbers(), properties.getTranslations());
    }

    /**
     * Creates a normalizer.
     *
     * @param expandNumbers spell out digits as Finnish words
     * @param translations  replacements applied after lower-casing; keys and values are lower-cased
     * @throws IllegalArgumentException if a translation value contains any translation key
     */
    public TextNormalizer(boolean expandNumbers, Map<String, String> translations) {
        this.expandNumbers = expandNumbers;
        Map<String, String> lowered = new LinkedHashMap<>();
        translations.forEach((k, v) -> {
            if (k == null || k.isEmpty()) {
                throw new IllegalArgumentException("Translation keys must not be empty");
            }
            lowered.put(lower(nfc(k)), v == null ? "" : lower(nfc(v)));
        });
        for (String value : lowered.values()) {
            for (String key : lowered.keySet()) {
                if (value.contains(key)) {
                    throw new IllegalArgumentException(
                            "Translation output '" + value + "' reintroduces translated key '" + key + "'");
                }
            }
        }
        this.translations = Collections.unmodifiableMap(lowered);
    }

    /**
     * Returns the canonical form of {@code raw}; empty for null or blank input.
     *
     * @throws IllegalStateException if the translations keep rewriting the text
     */
    public String normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            return "";
        }
        String text = lower(nfc(raw));
        if (expandNumbers) {
            text = FinnishNumberExpander.expandAll(text);
        }
        for (int pass = 0; pass < MAX_PASSES; pass++) {
            String next = lettersOnly(translate(text));
            if (next.equals(text)) {
                return next;
            }
            text = next;
        }
        throw new IllegalStateException("Translations do not settle on '" + text + "'");
    }

    private String translate(String text) {
        for (Map.Entry<String, String> t : translations.entrySet()) {
            text = text.replace(t.getKey(), t.getValue());
        }
        return text;
    }

    private static String lettersOnly(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        text.codePoints().forEach(cp -> {
            if (Character.isLetter(cp)) {
                sb.appendCodePoint(cp);
            } else {
                sb.append(' ');
            }
        });
        return sb.toString().trim().replaceAll(" +", " ");
    }

    /**
     * Normalizes and splits into words.
     *
     * @return immutable word list, empty if the text has no letters
     */
    public List<String> words(String raw) {
        String canonical = normalize(raw);
        if (canonical.isEmpty()) {
            return List.of();
        }
        return List.of(canonical.split(" "));
    }

    private static String nfc(String s) {
        return Normalizer.normalize(s, Normalizer.Form.NFC);
    }

    private static String lower(String s) {
        return s.toLowerCase(Locale.ROOT);
    }
}
