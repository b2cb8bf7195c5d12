package com.phillippitts.parlcorpus.logging;

import com.phillippitts.parlcorpus.config.properties.CorpusProperties;
import com.phillippitts.parlcorpus.config.properties.LabelingProperties;
import com.phillippitts.parlcorpus.domain.SessionId;
import com.phillippitts.parlcorpus.service.decoder.CandidateFileReader;
import com.phillippitts.parlcorpus.service.labeling.SegmentLabeler;
import com.phillippitts.parlcorpus.service.language.LanguageCodes;
import com.phillippitts.parlcorpus.service.language.LexicalLanguageClassifier;
import com.phillippitts.parlcorpus.service.language.MinorityStoplist;
import com.phillippitts.parlcorpus.service.orchestration.SessionPipeline;
import com.phillippitts.parlcorpus.service.reconcile.impl.EditDistanceAlignmentReconciler;
import com.phillippitts.parlcorpus.service.speaker.NameNormalizer;
import com.phillippitts.parlcorpus.service.speaker.SpeakerTable;
import com.phillippitts.parlcorpus.service.speaker.TableSpeakerResolver;
import com.phillippitts.parlcorpus.service.text.TextNormalizer;
import com.phillippitts.parlcorpus.service.transcript.JsonTranscriptParser;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.Logger;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.config.Configurator;
import org.apache.logging.log4j.core.filter.AbstractFilter;
import org.apache.logging.log4j.core.layout.PatternLayout;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Verifies that session log lines carry the session id in the Log4j2 ThreadContext,
 * which the {@code [session=%X{session}]} pattern prints.
 */
class SessionLoggingContextTest {

    private static final String LOGGER_NAME = SessionPipeline.class.getName();
    private static final SessionId SESSION = SessionId.parse("38-2019-042");

    @TempDir
    Path base;

    private InMemoryAppender appender;
    private Logger logger;

    @BeforeEach
    void setUpAppender() {
        Configurator.setLevel(LOGGER_NAME, Level.INFO);
        LoggerContext ctx = (LoggerContext) LogManager.getContext(false);
        logger = ctx.getLogger(LOGGER_NAME);
        appender = new InMemoryAppender("session-test-appender");
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void tearDownAppender() {
        if (logger != null && appender != null) {
            logger.removeAppender(appender);
            appender.stop();
        }
    }

    @Test
    void shouldTagSessionLogLinesWithSessionId() throws Exception {
        CorpusProperties corpus = CorpusProperties.under(base);
        TextNormalizer normalizer = new TextNormalizer(false, Map.of());
        SessionPipeline pipeline = new SessionPipeline(
                corpus,
                new JsonTranscriptParser(new LanguageCodes("fi", "sv")),
                new TableSpeakerResolver(SpeakerTable.empty(), new NameNormalizer(List.of())),
                new LexicalLanguageClassifier(new MinorityStoplist(List.of("och")), 0.15),
                normalizer,
                new CandidateFileReader(),
                new EditDistanceAlignmentReconciler(normalizer, 0.5, 100, 1000, 3),
                new SegmentLabeler(LabelingProperties.defaults()));
        Files.createDirectories(corpus.transcriptsPath());
        Files.createDirectories(corpus.candidatesPath());
        Files.writeString(pipeline.transcriptFile(SESSION),
                "{\"subsections\": [{\"statements\": [{\"mp_id\": 3, \"firstname\": \"A\", \"lastname\": \"B\","
                        + " \"language\": \"fi\", \"text\": \"Hyvä puhemies.\"}]}]}", StandardCharsets.UTF_8);
        Files.write(pipeline.candidatesFile(SESSION), List.of("0 100 hyvä puhemies"), StandardCharsets.UTF_8);

        pipeline.process(SESSION);

        LogEvent event = appender.getEvents().stream()
                .filter(e -> e.getMessage().getFormattedMessage().startsWith("Session done"))
                .findFirst()
                .orElseThrow();
        assertThat(event.getContextData().<String>getValue(SessionPipeline.SESSION_KEY))
                .isEqualTo("38-2019-042");
        assertThat(event.getMessage().getFormattedMessage()).contains("kept=1");
    }

    /**
     * Simple in-memory Log4j2 appender that captures LogEvents for assertions.
     */
    private static class InMemoryAppender extends AbstractAppender {
        private final List<LogEvent> events = new CopyOnWriteArrayList<>();

        protected InMemoryAppender(String name) {
            super(name, new AbstractFilter() {}, PatternLayout.createDefaultLayout(), true, null);
        }

        @Override
        public void append(LogEvent event) {
            events.add(event.toImmutable());
        }

        List<LogEvent> getEvents() {
            return events;
        }
    }
}
