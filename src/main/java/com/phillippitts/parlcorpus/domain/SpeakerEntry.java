package com.phillippitts.parlcorpus.domain;

import java.util.List;
import java.util.Objects;

/**
 * Row of the external speaker lookup table.
 *
 * @param speakerId resolved id
 * @param firstName first name(s) as printed in the table
 * @param lastName  last name as printed in the table
 * @param variants  alternative full names the speaker appears under
 */
public record SpeakerEntry(SpeakerId speakerId, String firstName, String lastName, List<String> variants) {

    public SpeakerEntry {
        Objects.requireNonNull(speakerId, "speakerId");
        if (!speakerId.isResolved()) {
            throw new IllegalArgumentException("Speaker table entries need a positive id");
        }
        firstName = firstName == null ? "" : firstName.trim();
        lastName = lastName == null ? "" : lastName.trim();
        variants = variants == null ? List.of() : List.copyOf(variants);
    }

    public String fullName() {
        return (firstName + " " + lastName).trim();
    }
}
