/* (C)2026 */
package com.ammann.qc.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class StreamingStateTest {

    @Test
    void appendEvictsOldestValueOnceFull() {
        StreamingState state = StreamingState.initial(3);
        for (double value = 1.0; value <= 5.0; value++) {
            state = state.append(value, CusumState.initial(), EwmaState.initial());
        }

        assertThat(state.trailing()).containsExactly(3.0, 4.0, 5.0);
        assertThat(state.trailingValues()).containsExactly(3.0, 4.0, 5.0);
        assertThat(state.nextIndex()).isEqualTo(5);
    }

    @Test
    void appendLeavesPreviousStateUntouched() {
        StreamingState first = StreamingState.initial(5).append(1.0, CusumState.initial(), EwmaState.initial());

        StreamingState second = first.append(2.0, new CusumState(1.0, 0.0, 2), new EwmaState(1.2, 2));

        assertThat(first.trailing()).containsExactly(1.0);
        assertThat(first.cusum()).isEqualTo(CusumState.initial());
        assertThat(second.trailing()).containsExactly(1.0, 2.0);
        assertThat(second.ewma().value()).isEqualTo(1.2);
    }

    @Test
    void capacityBelowTwoIsRejected() {
        assertThatThrownBy(() -> StreamingState.initial(1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void incrementalResultReportsIndexOfEvaluatedPoint() {
        StreamingState state =
                StreamingState.initial(4)
                        .append(1.0, CusumState.initial(), EwmaState.initial())
                        .append(2.0, CusumState.initial(), EwmaState.initial());

        assertThat(new IncrementalResult(state, List.of()).index()).isEqualTo(1);
    }
}
