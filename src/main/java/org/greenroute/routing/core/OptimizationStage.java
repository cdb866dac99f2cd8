package org.greenroute.routing.core;

/**
 * Per-call optimization lifecycle.
 *
 * <p>{@code INIT -> MATRIX_BUILT -> SOLVING -> (SOLVED | FALLBACK) -> ASSEMBLED ->
 * METRICS_COMPUTED -> DONE}.</p>
 */
public enum OptimizationStage {
    INIT,
    MATRIX_BUILT,
    SOLVING,
    SOLVED,
    FALLBACK,
    ASSEMBLED,
    METRICS_COMPUTED,
    DONE
}
