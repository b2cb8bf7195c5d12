package com.phillippitts.parlcorpus.service.assembly;

import com.phillippitts.parlcorpus.service.language.MinorityStoplist;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class VocabularyAssemblerTest {

    @TempDir
    Path tmp;

    @Test
    void shouldUnionWordFilesAndExistingVocabularyWithoutMinorityWords() throws Exception {
        Path a = tmp.resolve("a.words");
        Path b = tmp.resolve("b.words");
        Path vocabulary = tmp.resolve("out/vocabulary");
        VocabularyAssembler.mergeWords(a, List.of("puhemies", "och", "hyvä"));
        VocabularyAssembler.mergeWords(b, List.of("hyvä", "kiitos", "tack"));
        Files.createDirectories(vocabulary.getParent());
        Files.write(vocabulary, List.of("arvoisa"), StandardCharsets.UTF_8);

        VocabularyAssembler assembler = new VocabularyAssembler(new MinorityStoplist(List.of("och")),
                List.of("tack"));
        int size = assembler.assemble(List.of(a, b), vocabulary);

        assertThat(size).isEqualTo(4);
        assertThat(Files.readAllLines(vocabulary, StandardCharsets.UTF_8))
                .containsExactly("arvoisa", "hyvä", "kiitos", "puhemies");
    }

    @Test
    void shouldKeepWordFilesSortedAndUnique() throws Exception {
        Path file = tmp.resolve("s.words");

        VocabularyAssembler.mergeWords(file, List.of("b", "a"));
        int size = VocabularyAssembler.mergeWords(file, List.of("a", "c"));

        assertThat(size).isEqualTo(3);
        assertThat(VocabularyAssembler.readWords(file)).containsExactly("a", "b", "c");
    }

    @Test
    void shouldTreatMissingWordFileAsEmpty() {
        assertThat(VocabularyAssembler.readWords(tmp.resolve("missing.words"))).isEmpty();
    }
}
