package com.phillippitts.parlcorpus.config.properties;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Locations of pipeline inputs and outputs.
 * Binds to properties prefixed with "corpus".
 *
 * <p>Example application.properties:
 * <pre>
 * corpus.transcripts-dir=data/transcripts
 * corpus.candidates-dir=data/candidates
 * corpus.work-dir=data/work
 * corpus.output-dir=data/corpus
 * corpus.audio-path-template=corp/{year}/session-{number}-{year}.wav
 * </pre>
 *
 * @param transcriptsDir       directory holding {@code session-{id}.json} transcripts
 * @param candidatesDir        directory holding {@code session-{id}.candidates} decoder output
 * @param workDir              directory for per-session intermediate files
 * @param outputDir            directory of the merged corpus tables
 * @param audioPathTemplate    audio path pattern with {session}, {term}, {year} and {number}
 * @param requireExistingAudio exclude records whose audio file does not exist
 * @param minorityWordsFile    optional word list subtracted from the vocabulary, blank for none
 */
@ConfigurationProperties(prefix = "corpus")
@Validated
public record CorpusProperties(
        @NotBlank(message = "Transcripts directory must not be blank")
        String transcriptsDir,

        @NotBlank(message = "Candidates directory must not be blank")
        String candidatesDir,

        @NotBlank(message = "Work directory must not be blank")
        String workDir,

        @NotBlank(message = "Output directory must not be blank")
        String outputDir,

        @NotBlank(message = "Audio path template must not be blank")
        String audioPathTemplate,

        boolean requireExistingAudio,

        String minorityWordsFile
) {

    public CorpusProperties {
        transcriptsDir = transcriptsDir == null ? "data/transcripts" : transcriptsDir;
        candidatesDir = candidatesDir == null ? "data/candidates" : candidatesDir;
        workDir = workDir == null ? "data/work" : workDir;
        outputDir = outputDir == null ? "data/corpus" : outputDir;
        audioPathTemplate = audioPathTemplate == null
                ? "corp/{year}/session-{number}-{year}.wav" : audioPathTemplate;
        minorityWordsFile = minorityWordsFile == null ? "" : minorityWordsFile.trim();
    }

    /**
     * Creates properties rooted at a single base directory, as used by tests and local runs.
     */
    public static CorpusProperties under(Path base) {
        return new CorpusProperties(
                base.resolve("transcripts").toString(),
                base.resolve("candidates").toString(),
                base.resolve("work").toString(),
                base.resolve("corpus").toString(),
                base.resolve("audio").toString() + "/{year}/session-{number}-{year}.wav",
                false,
                "");
    }

    public Path transcriptsPath() {
        return Paths.get(transcriptsDir);
    }

    public Path candidatesPath() {
        return Paths.get(candidatesDir);
    }

    public Path workPath() {
        return Paths.get(workDir);
    }

    public Path outputPath() {
        return Paths.get(outputDir);
    }

    public boolean hasMinorityWordsFile() {
        return !minorityWordsFile.isBlank();
    }
}
