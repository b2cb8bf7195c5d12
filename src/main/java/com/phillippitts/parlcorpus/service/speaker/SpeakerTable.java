package com.phillippitts.parlcorpus.service.speaker;

import com.phillippitts.parlcorpus.domain.SpeakerEntry;
import com.phillippitts.parlcorpus.domain.SpeakerId;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read-only index over the speaker lookup table.
 *
 * <p>Built once and shared by all session tasks.
 */
public final class SpeakerTable {

    private final List<SpeakerEntry> entries;
    private final Map<String, Set<SpeakerId>> byFullName = new HashMap<>();
    private final Map<String, Set<SpeakerId>> byVariant = new HashMap<>();
    private final Map<String, List<Initialed>> byLastName = new HashMap<>();

    public SpeakerTable(List<SpeakerEntry> entries, NameNormalizer normalizer) {
        this.entries = List.copyOf(entries);
        Map<String, List<Initialed>> lastNames = new HashMap<>();
        for (SpeakerEntry e : this.entries) {
            String first = normalizer.key(e.firstName());
            String last = normalizer.key(e.lastName());
            add(byFullName, (first + " " + last).trim(), e.speakerId());
            for (String variant : e.variants()) {
                add(byVariant, normalizer.key(variant), e.speakerId());
            }
            if (!last.isEmpty() && !first.isEmpty()) {
                lastNames.computeIfAbsent(last, k -> new ArrayList<>())
                        .add(new Initialed(first, e.speakerId()));
            }
        }
        lastNames.forEach((k, v) -> byLastName.put(k, List.copyOf(v)));
    }

    public static SpeakerTable empty() {
        return new SpeakerTable(List.of(), new NameNormalizer(List.of()));
    }

    private static void add(Map<String, Set<SpeakerId>> index, String key, SpeakerId id) {
        if (!key.isEmpty()) {
            index.computeIfAbsent(key, k -> new LinkedHashSet<>()).add(id);
        }
    }

    Set<SpeakerId> fullName(String key) {
        return byFullName.getOrDefault(key, Set.of());
    }

    Set<SpeakerId> variant(String key) {
        return byVariant.getOrDefault(key, Set.of());
    }

    /**
     * Ids whose last name matches and whose first name starts with {@code initial}.
     */
    Set<SpeakerId> initialAndLastName(String initial, String lastName) {
        Set<SpeakerId> ids = new LinkedHashSet<>();
        for (Initialed i : byLastName.getOrDefault(lastName, List.of())) {
            if (i.firstName().startsWith(initial)) {
                ids.add(i.id());
            }
        }
        return ids;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    private record Initialed(String firstName, SpeakerId id) {
    }
}
