/* (C)2026 */
package com.ammann.qc.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ammann.qc.exception.ValidationException;
import org.junit.jupiter.api.Test;

class QueuedMeasurementSourceTest {

    @Test
    void valuesComeOutInArrivalOrderPerAnalyte() {
        QueuedMeasurementSource source = new QueuedMeasurementSource(10);
        source.offer("creatinine", 1.0);
        source.offer("urea", 25.0);
        source.offer("creatinine", 1.1);

        assertThat(source.pending("creatinine")).isEqualTo(2);
        assertThat(source.poll("creatinine").getAsDouble()).isEqualTo(1.0);
        assertThat(source.poll("creatinine").getAsDouble()).isEqualTo(1.1);
        assertThat(source.poll("creatinine")).isEmpty();
        assertThat(source.poll("urea").getAsDouble()).isEqualTo(25.0);
    }

    @Test
    void unknownAnalyteHasNothingPending() {
        QueuedMeasurementSource source = new QueuedMeasurementSource(10);

        assertThat(source.poll("glucose")).isEmpty();
        assertThat(source.pending("glucose")).isZero();
    }

    @Test
    void fullQueueRejectsWithoutBlocking() {
        QueuedMeasurementSource source = new QueuedMeasurementSource(2);

        assertThat(source.offer("urea", 1.0)).isTrue();
        assertThat(source.offer("urea", 2.0)).isTrue();
        assertThat(source.offer("urea", 3.0)).isFalse();
        assertThat(source.pending("urea")).isEqualTo(2);
    }

    @Test
    void nonFiniteValuesAreRejected() {
        QueuedMeasurementSource source = new QueuedMeasurementSource(2);

        assertThatThrownBy(() -> source.offer("urea", Double.NaN)).isInstanceOf(ValidationException.class);
        assertThat(source.pending("urea")).isZero();
    }

    @Test
    void capacityMustBePositive() {
        assertThatThrownBy(() -> new QueuedMeasurementSource(0)).isInstanceOf(ValidationException.class);
    }
}
