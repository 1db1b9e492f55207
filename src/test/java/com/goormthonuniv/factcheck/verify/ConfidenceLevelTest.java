package com.goormthonuniv.factcheck.verify;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ConfidenceLevelTest {

    @Test
    void sourceCountGateComesFirst() {
        assertThat(ConfidenceLevel.of(0, 100.0)).isEqualTo(ConfidenceLevel.LOW);
        assertThat(ConfidenceLevel.of(2, 95.0)).isEqualTo(ConfidenceLevel.LOW);
        assertThat(ConfidenceLevel.of(2, 70.0)).isEqualTo(ConfidenceLevel.LOW);
    }

    @Test
    void highNeedsFiveSourcesAndEighty() {
        assertThat(ConfidenceLevel.of(5, 80.0)).isEqualTo(ConfidenceLevel.HIGH);
        assertThat(ConfidenceLevel.of(9, 99.0)).isEqualTo(ConfidenceLevel.HIGH);
        assertThat(ConfidenceLevel.of(4, 99.0)).isEqualTo(ConfidenceLevel.MEDIUM);
    }

    @Test
    void mediumForThreeToFourSourcesOrSixtyToEighty() {
        assertThat(ConfidenceLevel.of(3, 10.0)).isEqualTo(ConfidenceLevel.MEDIUM);
        assertThat(ConfidenceLevel.of(6, 60.0)).isEqualTo(ConfidenceLevel.MEDIUM);
        assertThat(ConfidenceLevel.of(6, 79.9)).isEqualTo(ConfidenceLevel.MEDIUM);
    }

    @Test
    void manyLowAgreementSourcesStayLow() {
        assertThat(ConfidenceLevel.of(12, 59.9)).isEqualTo(ConfidenceLevel.LOW);
        assertThat(ConfidenceLevel.of(5, null)).isEqualTo(ConfidenceLevel.LOW);
    }
}
