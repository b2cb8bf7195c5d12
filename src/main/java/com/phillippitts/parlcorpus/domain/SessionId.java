package com.phillippitts.parlcorpus.domain;

import java.util.Comparator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Identifies one recorded parliamentary sitting.
 *
 * <p>The textual form {@code {term}-{year}-{number:03}} (for example {@code 38-2019-042}) is the
 * join key between the transcript document, the decoder output, the intermediate per-session
 * files and the utterance ids of the final corpus.
 *
 * @param term   parliamentary term number (positive)
 * @param year   calendar year of the sitting
 * @param number sequence number of the sitting within the year (positive)
 */
public record SessionId(int term, int year, int number) implements Comparable<SessionId> {

    private static final Pattern TEXT_FORM = Pattern.compile("(\\d+)-(\\d{4})-(\\d{3,})");

    private static final Comparator<SessionId> ORDER = Comparator.comparing(SessionId::toString);

    public SessionId {
        if (term <= 0) {
            throw new IllegalArgumentException("Term must be positive, got: " + term);
        }
        if (year < 1000 || year > 9999) {
            throw new IllegalArgumentException("Year must have four digits, got: " + year);
        }
        if (number <= 0) {
            throw new IllegalArgumentException("Session number must be positive, got: " + number);
        }
    }

    /**
     * Parses the textual form produced by {@link #toString()}.
     *
     * @param text session id such as {@code 38-2019-042}
     * @return parsed session id
     * @throws IllegalArgumentException if the text does not follow the session id format
     */
    public static SessionId parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Session id must not be null");
        }
        Matcher m = TEXT_FORM.matcher(text.trim());
        if (!m.matches()) {
            throw new IllegalArgumentException("Not a session id: '" + text + "'");
        }
        return new SessionId(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)),
                Integer.parseInt(m.group(3)));
    }

    /**
     * Returns true if the text is a well-formed session id.
     */
    public static boolean isValid(String text) {
        return text != null && TEXT_FORM.matcher(text.trim()).matches();
    }

    @Override
    public int compareTo(SessionId other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return String.format("%d-%d-%03d", term, year, number);
    }
}
