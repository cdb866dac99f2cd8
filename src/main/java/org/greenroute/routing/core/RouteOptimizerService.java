package org.greenroute.routing.core;

/**
 * Client-facing route optimization service contract.
 */
public interface RouteOptimizerService {
    /**
     * Computes an optimized single-vehicle route.
     *
     * @param request optimization request.
     * @return route, metrics and quality flag.
     * @throws RouteOptimizationException on invalid requests or fatal internal errors.
     */
    OptimizationResult optimize(OptimizeRequest request);
}
