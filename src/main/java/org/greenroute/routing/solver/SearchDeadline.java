package org.greenroute.routing.solver;

import java.time.Duration;
import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * Wall-clock budget for one solver run.
 *
 * <p>The routing search receives {@link #remaining()} as its time limit; callers poll
 * {@link #isExpired()} afterwards.</p>
 */
public final class SearchDeadline {
    public static final Duration DEFAULT_TIME_LIMIT = Duration.ofSeconds(30);

    static final String PROP_TIME_LIMIT_MILLIS = "greenroute.solver.timeLimitMillis";

    private final LongSupplier nanoClock;
    private final long startNanos;
    private final long budgetNanos;

    private SearchDeadline(Duration budget, LongSupplier nanoClock) {
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
        this.startNanos = nanoClock.getAsLong();
        this.budgetNanos = Math.max(0L, Objects.requireNonNull(budget, "budget").toNanos());
    }

    /**
     * Starts a deadline that expires {@code budget} from now.
     */
    public static SearchDeadline after(Duration budget) {
        return new SearchDeadline(budget, System::nanoTime);
    }

    /**
     * Starts a deadline against an explicit monotonic nanosecond source.
     */
    public static SearchDeadline after(Duration budget, LongSupplier nanoClock) {
        return new SearchDeadline(budget, nanoClock);
    }

    /**
     * Returns the configured default budget.
     *
     * <p>Reads {@value #PROP_TIME_LIMIT_MILLIS}; blank, malformed or non-positive values
     * resolve to {@link #DEFAULT_TIME_LIMIT}.</p>
     */
    public static Duration configuredTimeLimit() {
        String raw = System.getProperty(PROP_TIME_LIMIT_MILLIS);
        if (raw == null || raw.isBlank()) {
            return DEFAULT_TIME_LIMIT;
        }
        try {
            long millis = Long.parseLong(raw.trim());
            return millis > 0L ? Duration.ofMillis(millis) : DEFAULT_TIME_LIMIT;
        } catch (NumberFormatException ex) {
            return DEFAULT_TIME_LIMIT;
        }
    }

    public boolean isExpired() {
        return elapsedNanos() >= budgetNanos;
    }

    public long elapsedNanos() {
        return nanoClock.getAsLong() - startNanos;
    }

    /**
     * Budget left, never negative.
     */
    public Duration remaining() {
        return Duration.ofNanos(Math.max(0L, budgetNanos - elapsedNanos()));
    }

    public Duration budget() {
        return Duration.ofNanos(budgetNanos);
    }
}
