package org.greenroute.routing.store;

import org.greenroute.routing.core.OptimizationResult;

import java.util.Optional;

/**
 * Caller-side persistence for optimization results.
 *
 * <p>The optimizer never calls this; callers save a result after a successful optimize.</p>
 */
public interface RouteStore {
    void save(String routeId, OptimizationResult result);

    Optional<OptimizationResult> find(String routeId);
}
