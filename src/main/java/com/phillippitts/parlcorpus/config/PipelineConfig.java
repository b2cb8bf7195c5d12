package com.phillippitts.parlcorpus.config;

import com.phillippitts.parlcorpus.config.properties.CorpusProperties;
import com.phillippitts.parlcorpus.config.properties.LabelingProperties;
import com.phillippitts.parlcorpus.config.properties.LanguageProperties;
import com.phillippitts.parlcorpus.config.properties.NormalizationProperties;
import com.phillippitts.parlcorpus.config.properties.PipelineProperties;
import com.phillippitts.parlcorpus.config.properties.ReconciliationProperties;
import com.phillippitts.parlcorpus.config.properties.SpeakerProperties;
import com.phillippitts.parlcorpus.service.assembly.AudioPathResolver;
import com.phillippitts.parlcorpus.service.assembly.CorpusAssembler;
import com.phillippitts.parlcorpus.service.assembly.VocabularyAssembler;
import com.phillippitts.parlcorpus.service.decoder.CandidateFileReader;
import com.phillippitts.parlcorpus.service.labeling.SegmentLabeler;
import com.phillippitts.parlcorpus.service.language.LanguageClassifier;
import com.phillippitts.parlcorpus.service.language.LanguageCodes;
import com.phillippitts.parlcorpus.service.language.LexicalLanguageClassifier;
import com.phillippitts.parlcorpus.service.language.MinorityStoplist;
import com.phillippitts.parlcorpus.service.language.SecondaryLanguageFilter;
import com.phillippitts.parlcorpus.service.metrics.PipelineMetrics;
import com.phillippitts.parlcorpus.service.orchestration.CorpusPipeline;
import com.phillippitts.parlcorpus.service.orchestration.DefaultCorpusPipeline;
import com.phillippitts.parlcorpus.service.orchestration.ParallelSessionService;
import com.phillippitts.parlcorpus.service.orchestration.SessionPipeline;
import com.phillippitts.parlcorpus.service.reconcile.AlignmentReconciler;
import com.phillippitts.parlcorpus.service.reconcile.impl.EditDistanceAlignmentReconciler;
import com.phillippitts.parlcorpus.service.speaker.NameNormalizer;
import com.phillippitts.parlcorpus.service.speaker.SpeakerResolver;
import com.phillippitts.parlcorpus.service.speaker.SpeakerTable;
import com.phillippitts.parlcorpus.service.speaker.SpeakerTableLoader;
import com.phillippitts.parlcorpus.service.speaker.TableSpeakerResolver;
import com.phillippitts.parlcorpus.service.text.TextNormalizer;
import com.phillippitts.parlcorpus.service.transcript.JsonTranscriptParser;
import com.phillippitts.parlcorpus.service.transcript.TranscriptParser;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Paths;
import java.util.List;

/**
 * Wires the per-session components and the assembly stage from typed properties.
 */
@Configuration
public class PipelineConfig {

    @Bean
    public NameNormalizer nameNormalizer(SpeakerProperties props) {
        return new NameNormalizer(props.getTitlePrefixes());
    }

    @Bean
    public SpeakerTable speakerTable(SpeakerProperties props, NameNormalizer nameNormalizer) {
        return SpeakerTableLoader.load(Paths.get(props.getTablePath()), nameNormalizer);
    }

    @Bean
    public SpeakerResolver speakerResolver(SpeakerTable speakerTable, NameNormalizer nameNormalizer) {
        return new TableSpeakerResolver(speakerTable, nameNormalizer);
    }

    @Bean
    public LanguageCodes languageCodes(LanguageProperties props) {
        return new LanguageCodes(props);
    }

    @Bean
    public MinorityStoplist minorityStoplist(LanguageProperties props) {
        return new MinorityStoplist(props.getStoplist());
    }

    /**
     * Lexical fallback; a model-backed classifier bean takes precedence.
     */
    @Bean
    @ConditionalOnMissingBean(LanguageClassifier.class)
    public LanguageClassifier languageClassifier(MinorityStoplist stoplist, LanguageProperties props) {
        return new LexicalLanguageClassifier(stoplist, props.getClassifierMinDensity());
    }

    @Bean
    public TextNormalizer textNormalizer(NormalizationProperties props) {
        return new TextNormalizer(props);
    }

    @Bean
    public TranscriptParser transcriptParser(LanguageCodes languageCodes) {
        return new JsonTranscriptParser(languageCodes);
    }

    @Bean
    public CandidateFileReader candidateFileReader() {
        return new CandidateFileReader();
    }

    @Bean
    public AlignmentReconciler alignmentReconciler(TextNormalizer normalizer, ReconciliationProperties props) {
        return new EditDistanceAlignmentReconciler(normalizer, props.getRealignThreshold(),
                props.getSearchWindowBackward(), props.getSearchWindowForward(), props.getLengthSlack());
    }

    @Bean
    public SegmentLabeler segmentLabeler(LabelingProperties props) {
        return new SegmentLabeler(props);
    }

    @Bean
    public SessionPipeline sessionPipeline(CorpusProperties corpus,
                                           TranscriptParser parser,
                                           SpeakerResolver speakerResolver,
                                           LanguageClassifier classifier,
                                           TextNormalizer normalizer,
                                           CandidateFileReader candidateReader,
                                           AlignmentReconciler reconciler,
                                           SegmentLabeler labeler) {
        return new SessionPipeline(corpus, parser, speakerResolver, classifier, normalizer,
                candidateReader, reconciler, labeler);
    }

    @Bean
    public AudioPathResolver audioPathResolver(CorpusProperties corpus) {
        return new AudioPathResolver(corpus.audioPathTemplate());
    }

    @Bean
    public CorpusAssembler corpusAssembler(CorpusProperties corpus, AudioPathResolver audioPaths,
                                           MinorityStoplist stoplist, LanguageProperties language) {
        LanguageProperties.Filter f = language.getFilter();
        SecondaryLanguageFilter filter = f.enabled()
                ? new SecondaryLanguageFilter(stoplist, f.minHits(), f.minDensity())
                : null;
        return new CorpusAssembler(audioPaths, filter, corpus.requireExistingAudio());
    }

    @Bean
    public VocabularyAssembler vocabularyAssembler(CorpusProperties corpus, MinorityStoplist stoplist) {
        List<String> minorityWords = corpus.hasMinorityWordsFile()
                ? VocabularyAssembler.readWords(Paths.get(corpus.minorityWordsFile()))
                : List.of();
        return new VocabularyAssembler(stoplist, minorityWords);
    }

    @Bean
    public CorpusPipeline corpusPipeline(CorpusProperties corpus,
                                         PipelineProperties pipeline,
                                         ParallelSessionService sessions,
                                         CorpusAssembler assembler,
                                         VocabularyAssembler vocabularyAssembler,
                                         PipelineMetrics metrics) {
        return new DefaultCorpusPipeline(corpus, pipeline, sessions, assembler, vocabularyAssembler, metrics);
    }
}
