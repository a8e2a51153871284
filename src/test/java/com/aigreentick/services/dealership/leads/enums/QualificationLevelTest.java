package com.aigreentick.services.dealership.leads.enums;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class QualificationLevelTest {

    @ParameterizedTest
    @CsvSource({
            "100.0, QUALIFIED",
            "80.0, QUALIFIED",
            "79.9, HOT",
            "60.0, HOT",
            "59.99, WARM",
            "40.0, WARM",
            "39.9, COLD",
            "0.0, COLD"
    })
    @DisplayName("Lower bounds are inclusive")
    void fromPercentage(double percentage, QualificationLevel expected) {
        assertThat(QualificationLevel.fromPercentage(percentage)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Only QUALIFIED and HOT leads trigger assignment")
    void triggersAssignment() {
        assertThat(QualificationLevel.QUALIFIED.triggersAssignment()).isTrue();
        assertThat(QualificationLevel.HOT.triggersAssignment()).isTrue();
        assertThat(QualificationLevel.WARM.triggersAssignment()).isFalse();
        assertThat(QualificationLevel.COLD.triggersAssignment()).isFalse();
    }

    @Test
    @DisplayName("Conversion grades follow the probability bands")
    void conversionGrade() {
        assertThat(ConversionGrade.fromProbability(0.8)).isEqualTo(ConversionGrade.A);
        assertThat(ConversionGrade.fromProbability(0.79)).isEqualTo(ConversionGrade.B);
        assertThat(ConversionGrade.fromProbability(0.4)).isEqualTo(ConversionGrade.C);
        assertThat(ConversionGrade.fromProbability(0.25)).isEqualTo(ConversionGrade.D);
        assertThat(ConversionGrade.fromProbability(0.1)).isEqualTo(ConversionGrade.F);
    }
}
