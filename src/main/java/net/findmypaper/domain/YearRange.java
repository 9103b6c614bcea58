package net.findmypaper.domain;

import jakarta.annotation.Nullable;

/**
 * Optional inclusive publication-year window.
 *
 * @param since earliest year kept, or null for no lower bound
 * @param to latest year kept, or null for no upper bound
 */
public record YearRange(@Nullable Integer since, @Nullable Integer to) {

    private static final YearRange UNBOUNDED = new YearRange(null, null);

    public YearRange {
        if (since != null && to != null && since > to) {
            throw new IllegalArgumentException("since (" + since + ") must not be after to (" + to + ")");
        }
    }

    public static YearRange unbounded() {
        return UNBOUNDED;
    }

    public static YearRange of(@Nullable Integer since, @Nullable Integer to) {
        return since == null && to == null ? UNBOUNDED : new YearRange(since, to);
    }

    public boolean isBounded() {
        return since != null || to != null;
    }

    /**
     * Whether {@code year} lies in the window. An unknown year only passes an unbounded window.
     */
    public boolean contains(@Nullable Integer year) {
        if (!isBounded()) {
            return true;
        }
        if (year == null) {
            return false;
        }
        return (since == null || year >= since) && (to == null || year <= to);
    }

    @Override
    public String toString() {
        if (!isBounded()) {
            return "any year";
        }
        return (since == null ? "..." : since) + "-" + (to == null ? "..." : to);
    }
}
