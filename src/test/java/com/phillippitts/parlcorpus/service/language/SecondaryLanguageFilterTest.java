package com.phillippitts.parlcorpus.service.language;

import com.phillippitts.parlcorpus.domain.CorpusRecord;
import com.phillippitts.parlcorpus.domain.SessionId;
import com.phillippitts.parlcorpus.domain.SpeakerId;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SecondaryLanguageFilterTest {

    private static final SessionId SESSION = SessionId.parse("38-2019-042");
    private static final MinorityStoplist STOPLIST = new MinorityStoplist(List.of("jag", "och", "att", "det"));

    private static CorpusRecord record(long start, String text) {
        return CorpusRecord.of(SESSION, start, start + 100, SpeakerId.of(1), text);
    }

    @Test
    void shouldRemoveRecordsWithStopwordHits() {
        SecondaryLanguageFilter filter = new SecondaryLanguageFilter(STOPLIST, 1, 0.0);
        CorpusRecord finnish = record(0, "arvoisa puhemies");
        CorpusRecord swedish = record(200, "jag tackar och det");

        SecondaryLanguageFilter.FilterResult result = filter.filter(List.of(finnish, swedish));

        assertThat(result.kept()).containsExactly(finnish);
        assertThat(result.removed()).containsExactly(swedish);
    }

    @Test
    void shouldRespectMinimumHitsAndDensity() {
        SecondaryLanguageFilter strict = new SecondaryLanguageFilter(STOPLIST, 2, 0.5);
        assertThat(strict.isMinority("jag tackar för debatten i dag")).isFalse();
        assertThat(strict.isMinority("jag och det")).isTrue();
    }

    @Test
    void shouldAlsoRemoveQuotedMinorityPhrases() {
        SecondaryLanguageFilter filter = new SecondaryLanguageFilter(STOPLIST, 1, 0.0);
        assertThat(filter.isMinority("hän sanoi että det är bra")).isTrue();
    }
}
