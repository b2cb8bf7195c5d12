package com.phillippitts.parlcorpus.service.speaker;

import com.phillippitts.parlcorpus.domain.SessionId;
import com.phillippitts.parlcorpus.domain.SpeakerId;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Set;

/**
 * Resolves printed names against the speaker lookup table by normalized-string matching.
 *
 * <p>Match order:
 * <ol>
 *   <li>normalized full name</li>
 *   <li>normalized name variant</li>
 *   <li>first-name initial plus last name, e.g. {@code A. Virtanen}</li>
 * </ol>
 * A step that matches more than one id makes the name ambiguous; ambiguous and unknown names
 * resolve to {@link SpeakerId#UNRESOLVED}.
 */
public class TableSpeakerResolver implements SpeakerResolver {

    private static final Logger LOG = LogManager.getLogger(TableSpeakerResolver.class);

    private final SpeakerTable table;
    private final NameNormalizer normalizer;

    public TableSpeakerResolver(SpeakerTable table, NameNormalizer normalizer) {
        this.table = table;
        this.normalizer = normalizer;
    }

    @Override
    public SpeakerId resolve(String rawName, SessionId session) {
        String key = normalizer.key(rawName);
        if (key.isEmpty()) {
            return SpeakerId.UNRESOLVED;
        }

        Set<SpeakerId> ids = table.fullName(key);
        if (ids.isEmpty()) {
            ids = table.variant(key);
        }
        if (ids.isEmpty()) {
            ids = byInitial(normalizer.normalize(rawName));
        }

        if (ids.size() == 1) {
            return ids.iterator().next();
        }
        if (ids.isEmpty()) {
            LOG.info("Unresolved speaker '{}' in session {}", rawName, session);
        } else {
            LOG.warn("Ambiguous speaker '{}' in session {} matches {}", rawName, session, ids);
        }
        return SpeakerId.UNRESOLVED;
    }

    private Set<SpeakerId> byInitial(String normalized) {
        int space = normalized.indexOf(' ');
        if (space <= 0) {
            return Set.of();
        }
        String first = normalized.substring(0, space).replace(".", "");
        boolean abbreviated = normalized.substring(0, space).endsWith(".") || first.length() == 1;
        if (!abbreviated || first.isEmpty()) {
            return Set.of();
        }
        String last = normalized.substring(space + 1).replace(".", "").trim();
        return table.initialAndLastName(first, last);
    }
}
