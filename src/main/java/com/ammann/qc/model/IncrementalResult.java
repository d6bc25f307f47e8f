/* (C)2026 */
package com.ammann.qc.model;

import java.util.List;

/**
 * Outcome of evaluating one new point against retained streaming state.
 *
 * @param state      state including the new point
 * @param violations violations raised at the new point
 */
public record IncrementalResult(StreamingState state, List<Violation> violations) {

    public IncrementalResult {
        violations = List.copyOf(violations);
    }

    /** Index assigned to the evaluated point. */
    public int index() {
        return state.nextIndex() - 1;
    }
}
