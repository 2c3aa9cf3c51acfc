package com.errlens.core.extractor;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ExtractorHintsTest {

    @Test
    void matches_requiredAndAnyOfAndForbidden_combineWithAnd() {
        // Given
        ExtractorHints hints = ExtractorHints.required("[ERROR]")
            .withAnyOf("Tests run:", "<<< FAILURE!")
            .withForbidden("<testsuite");

        // Then
        assertThat(hints.matches("[ERROR] Tests run: 3, Failures: 1")).isTrue();
        assertThat(hints.matches("[ERROR] something else")).isFalse();
        assertThat(hints.matches("Tests run: 3 <<< FAILURE!")).isFalse();
        assertThat(hints.matches("[ERROR] Tests run: 1 <testsuite name=\"x\">")).isFalse();
    }

    @Test
    void matches_noneHints_acceptEverythingIncludingNull() {
        ExtractorHints hints = ExtractorHints.none();

        assertThat(hints.isEmpty()).isTrue();
        assertThat(hints.matches("anything")).isTrue();
        assertThat(hints.matches(null)).isTrue();
    }

    @Test
    void matches_nullOutput_failsNonEmptyHints() {
        assertThat(ExtractorHints.anyOf("FAIL").matches(null)).isFalse();
    }

    @Test
    void toPrefilter_emptyAnyOf_doesNotRestrict() {
        // Given
        OutputPrefilter filter = ExtractorHints.required("error TS").toPrefilter();

        // Then
        assertThat(filter.test("src/a.ts(1,1): error TS2304: Cannot find name 'x'.")).isTrue();
        assertThat(filter.test("warning only")).isFalse();
    }
}
