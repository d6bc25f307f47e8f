/* (C)2026 */
package com.ammann.qc.enumeration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class SeverityAndDispositionTest {

    @Test
    void worstPicksHigherRank() {
        assertThat(Severity.WARNING.worst(Severity.CRITICAL)).isEqualTo(Severity.CRITICAL);
        assertThat(Severity.CRITICAL.worst(Severity.WARNING)).isEqualTo(Severity.CRITICAL);
        assertThat(Severity.WARNING.worst(null)).isEqualTo(Severity.WARNING);
    }

    @Test
    void actionFollowsSeverity() {
        assertThat(RecommendedAction.forSeverity(Severity.CRITICAL)).isEqualTo(RecommendedAction.REJECT);
        assertThat(RecommendedAction.forSeverity(Severity.WARNING)).isEqualTo(RecommendedAction.WARN);
    }

    @ParameterizedTest
    @CsvSource({"0,0,IN_CONTROL", "0,3,NEEDS_REVIEW", "1,0,REJECT", "2,5,REJECT"})
    void dispositionFromCounts(long critical, long warning, Disposition expected) {
        assertThat(Disposition.fromCounts(critical, warning)).isEqualTo(expected);
    }

    @ParameterizedTest
    @ValueSource(strings = {"high", "HIGH", " High "})
    void sensitivityLabelsAreCaseInsensitive(String label) {
        assertThat(Sensitivity.fromLabel(label)).isEqualTo(Sensitivity.HIGH);
    }

    @Test
    void unknownSensitivityLabelIsRejected() {
        assertThatThrownBy(() -> Sensitivity.fromLabel("extreme"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Sensitivity.fromLabel(" "))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
