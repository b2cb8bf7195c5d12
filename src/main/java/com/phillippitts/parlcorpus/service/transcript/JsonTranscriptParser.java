package com.phillippitts.parlcorpus.service.transcript;

import com.phillippitts.parlcorpus.domain.Language;
import com.phillippitts.parlcorpus.domain.SessionId;
import com.phillippitts.parlcorpus.domain.SessionTranscript;
import com.phillippitts.parlcorpus.domain.SpeakerId;
import com.phillippitts.parlcorpus.domain.SpeechTurn;
import com.phillippitts.parlcorpus.exception.ParlCorpusException;
import com.phillippitts.parlcorpus.exception.TranscriptParseException;
import com.phillippitts.parlcorpus.service.language.LanguageCodes;
import com.phillippitts.parlcorpus.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads session transcripts in the downloader's JSON layout.
 *
 * <pre>{@code
 * {"number": 42, "year": 2019,
 *  "subsections": [{"number": "3", "statements": [
 *    {"type": "L", "mp_id": 1234, "firstname": "Anna", "lastname": "Virtanen",
 *     "language": "fi", "text": "... #ch_statement ...",
 *     "embedded_statement": {"title": "Puhemies", "firstname": "Matti", "lastname": "Vanhanen",
 *                            "text": "..."}}]}]}
 * }</pre>
 *
 * <p>A chairman's interjection is stored inside the interrupted statement and its position is
 * marked by {@value #EMBEDDED_MARKER}; such a statement becomes three turns (before, chairman,
 * after). A marker without an embedded statement, an embedded statement without a marker, more
 * than one marker, or a statement without string text is malformed and skipped.
 */
public class JsonTranscriptParser implements TranscriptParser {

    private static final Logger LOG = LogManager.getLogger(JsonTranscriptParser.class);

    static final String EMBEDDED_MARKER = "#ch_statement";

    private final LanguageCodes languageCodes;

    public JsonTranscriptParser(LanguageCodes languageCodes) {
        this.languageCodes = languageCodes;
    }

    @Override
    public SessionTranscript parse(SessionId session, Path file) {
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new TranscriptParseException(session.toString(), "cannot read " + file, e);
        }
        return parse(session, content);
    }

    @Override
    public SessionTranscript parse(SessionId session, String content) {
        JSONObject doc;
        try {
            doc = new JSONObject(content);
        } catch (JSONException e) {
            throw new TranscriptParseException(session.toString(), "not a JSON object", e);
        }
        JSONArray subsections = doc.optJSONArray("subsections");
        if (subsections == null) {
            throw new TranscriptParseException(session.toString(), "no subsections array");
        }
        checkHeader(session, doc);

        List<SpeechTurn> turns = new ArrayList<>();
        int skipped = 0;
        for (int s = 0; s < subsections.length(); s++) {
            JSONObject sub = subsections.optJSONObject(s);
            JSONArray statements = sub == null ? null : sub.optJSONArray("statements");
            if (statements == null) {
                LOG.warn("Session {}: subsection {} has no statements array, skipped", session, s);
                continue;
            }
            for (int i = 0; i < statements.length(); i++) {
                JSONObject statement = statements.optJSONObject(i);
                String where = "subsection " + sub.optString("number", String.valueOf(s)) + " statement " + i;
                if (statement == null) {
                    LOG.warn("Session {}: {} is not an object, skipped", session, where);
                    skipped++;
                    continue;
                }
                try {
                    addStatement(session, statement, turns);
                } catch (MalformedStatementException e) {
                    LOG.warn("Session {}: {} skipped: {}", session, where, e.getMessage());
                    skipped++;
                }
            }
        }
        LOG.debug("Session {}: parsed {} turns, skipped {} statements", session, turns.size(), skipped);
        return new SessionTranscript(session, turns, skipped);
    }

    private void checkHeader(SessionId session, JSONObject doc) {
        int number = doc.optInt("number", session.number());
        int year = doc.optInt("year", session.year());
        if (number != session.number() || year != session.year()) {
            LOG.warn("Session {}: transcript header says number={} year={}", session, number, year);
        }
    }

    private void addStatement(SessionId session, JSONObject statement, List<SpeechTurn> turns) {
        Object textValue = statement.opt("text");
        if (!(textValue instanceof String text)) {
            throw new MalformedStatementException("text is missing or not a string");
        }
        JSONObject embedded = statement.optJSONObject("embedded_statement");
        String embeddedText = embedded == null ? "" : embedded.optString("text", "").trim();

        int first = text.indexOf(EMBEDDED_MARKER);
        int markers = first < 0 ? 0 : text.split(EMBEDDED_MARKER, -1).length - 1;
        if (markers > 1) {
            throw new MalformedStatementException("nested markup: " + markers + " embedded statement markers");
        }
        if (markers == 1 && embeddedText.isEmpty()) {
            throw new MalformedStatementException("embedded statement marker without embedded statement");
        }
        if (markers == 0 && !embeddedText.isEmpty()) {
            throw new MalformedStatementException("embedded statement '"
                    + LogSanitizer.preview(embeddedText) + "' without a marker");
        }

        String speaker = name(statement);
        int mpId = statement.optInt("mp_id", 0);
        SpeakerId declared = mpId > 0 ? SpeakerId.of(mpId) : SpeakerId.UNRESOLVED;
        Language language = languageCodes.fromCode(statement.optString("language", ""));

        if (markers == 0) {
            addTurn(session, turns, speaker, declared, text, language);
            return;
        }
        addTurn(session, turns, speaker, declared, text.substring(0, first), language);
        addTurn(session, turns, name(embedded), SpeakerId.UNRESOLVED, embeddedText, Language.UNDETERMINED);
        addTurn(session, turns, speaker, declared, text.substring(first + EMBEDDED_MARKER.length()), language);
    }

    private static void addTurn(SessionId session, List<SpeechTurn> turns, String speaker, SpeakerId declared,
                                String text, Language language) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return;
        }
        SpeechTurn turn = SpeechTurn.parsed(session, turns.size(), speaker, declared, trimmed, language);
        if (turn.speakerMissing()) {
            LOG.warn("Session {}: turn {} has no speaker: '{}'", session, turn.index(),
                    LogSanitizer.preview(trimmed));
        }
        turns.add(turn);
    }

    private static String name(JSONObject statement) {
        String first = statement.optString("firstname", "").trim();
        String last = statement.optString("lastname", "").trim();
        return (first + " " + last).trim();
    }

    private static final class MalformedStatementException extends ParlCorpusException {
        MalformedStatementException(String message) {
            super(message);
        }
    }
}
