package org.greenroute.routing.route;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Internal invariant breach while turning a solution into a route.
 */
@Getter
@Accessors(fluent = true)
public final class RouteAssemblyException extends RuntimeException {
    public static final String REASON_SIZE_MISMATCH = "ASSEMBLY_SIZE_MISMATCH";

    private final String reasonCode;

    RouteAssemblyException(String reasonCode, String message) {
        super(message);
        this.reasonCode = reasonCode;
    }
}
