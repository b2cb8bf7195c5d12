package com.phillippitts.parlcorpus.service.assembly;

import com.phillippitts.parlcorpus.domain.SessionId;

import java.nio.file.Files;
import java.nio.file.Paths;

/**
 * Derives a session's audio source path from a configurable template.
 *
 * <p>Placeholders: {@code {session}} (full session id), {@code {term}}, {@code {year}} and
 * {@code {number}} (zero-padded to three digits). Example:
 * {@code corp/{year}/session-{number}-{year}.wav} gives {@code corp/2019/session-042-2019.wav}.
 */
public class AudioPathResolver {

    private final String template;

    public AudioPathResolver(String template) {
        if (template == null || template.isBlank()) {
            throw new IllegalArgumentException("Audio path template must not be blank");
        }
        if (!template.contains("{session}") && !template.contains("{number}")) {
            throw new IllegalArgumentException(
                    "Audio path template must contain {session} or {number}: " + template);
        }
        this.template = template;
    }

    public String resolve(SessionId session) {
        return template
                .replace("{session}", session.toString())
                .replace("{term}", String.valueOf(session.term()))
                .replace("{year}", String.valueOf(session.year()))
                .replace("{number}", String.format("%03d", session.number()));
    }

    public boolean exists(SessionId session) {
        return Files.isRegularFile(Paths.get(resolve(session)));
    }
}
