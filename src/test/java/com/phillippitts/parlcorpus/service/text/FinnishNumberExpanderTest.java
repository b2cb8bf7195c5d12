package com.phillippitts.parlcorpus.service.text;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FinnishNumberExpanderTest {

    @Test
    void shouldSpellSmallNumbers() {
        assertThat(FinnishNumberExpander.spell("0")).isEqualTo("nolla");
        assertThat(FinnishNumberExpander.spell("7")).isEqualTo("seitsemän");
        assertThat(FinnishNumberExpander.spell("10")).isEqualTo("kymmenen");
        assertThat(FinnishNumberExpander.spell("13")).isEqualTo("kolmetoista");
        assertThat(FinnishNumberExpander.spell("42")).isEqualTo("neljäkymmentäkaksi");
    }

    @Test
    void shouldSpellHundredsAndThousandsAsCompounds() {
        assertThat(FinnishNumberExpander.spell("100")).isEqualTo("sata");
        assertThat(FinnishNumberExpander.spell("305")).isEqualTo("kolmesataaviisi");
        assertThat(FinnishNumberExpander.spell("1000")).isEqualTo("tuhat");
        assertThat(FinnishNumberExpander.spell("2019")).isEqualTo("kaksituhattayhdeksäntoista");
    }

    @Test
    void shouldWriteMillionsAsSeparateWords() {
        assertThat(FinnishNumberExpander.spell("1000000")).isEqualTo("miljoona");
        assertThat(FinnishNumberExpander.spell("2000100")).isEqualTo("kaksi miljoonaa sata");
    }

    @Test
    void shouldReadLeadingZeroRunsDigitByDigit() {
        assertThat(FinnishNumberExpander.spell("007")).isEqualTo("nolla nolla seitsemän");
    }

    @Test
    void shouldJoinThousandsGroupsBeforeSpelling() {
        assertThat(FinnishNumberExpander.expandAll("10 000 euroa").trim().replaceAll(" +", " "))
                .isEqualTo("kymmenentuhatta euroa");
    }

    @Test
    void shouldRejectNonDigits() {
        assertThatThrownBy(() -> FinnishNumberExpander.spell("12a"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
