package com.phillippitts.parlcorpus;

import com.phillippitts.parlcorpus.config.properties.CorpusProperties;
import com.phillippitts.parlcorpus.config.properties.LabelingProperties;
import com.phillippitts.parlcorpus.config.properties.LanguageProperties;
import com.phillippitts.parlcorpus.config.properties.NormalizationProperties;
import com.phillippitts.parlcorpus.config.properties.PipelineProperties;
import com.phillippitts.parlcorpus.config.properties.ReconciliationProperties;
import com.phillippitts.parlcorpus.config.properties.SpeakerProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        CorpusProperties.class,
        SpeakerProperties.class,
        LanguageProperties.class,
        NormalizationProperties.class,
        ReconciliationProperties.class,
        LabelingProperties.class,
        PipelineProperties.class
})
public class ParlCorpusApplication {

    public static void main(String[] args) {
        SpringApplication.run(ParlCorpusApplication.class, args);
    }

}
