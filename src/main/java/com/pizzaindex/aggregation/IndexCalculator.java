package com.pizzaindex.aggregation;

/**
 * Maps average popularity onto the index scale and computes period-over-period change.
 *
 * The map is fixed: {@code index = 100 + avg * 0.8}, so popularity 0-100 lands on 100-180.
 */
public final class IndexCalculator {

    public static final double BASE_VALUE = 100.0;
    public static final double SCALE = 0.8;

    private IndexCalculator() {
    }

    /** Returns the index for an average popularity, rounded to one decimal. */
    public static double indexValue(double avgPopularity) {
        return round1(BASE_VALUE + avgPopularity * SCALE);
    }

    /**
     * Compares the current bucket against the preceding one.
     * Zero when either side had no valid samples; callers check sample counts
     * before reading a zero as "unchanged".
     */
    public static Change change(double currentIndex, int currentSamples, double previousIndex, int previousSamples) {
        if (currentSamples == 0 || previousSamples == 0) {
            return Change.NONE;
        }
        return change(currentIndex, previousIndex);
    }

    /**
     * {@code change = round1(current - previous)};
     * {@code percent = round2(change / previous * 100)} when previous is positive, else 0.
     */
    public static Change change(double currentIndex, double previousIndex) {
        double change = round1(currentIndex - previousIndex);
        double percent = previousIndex > 0 ? round2(change / previousIndex * 100.0) : 0.0;
        return new Change(change, percent);
    }

    public static double round1(double value) {
        return Math.round(value * 10.0) / 10.0;
    }

    public static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    /** Absolute and relative change between two index values. */
    public record Change(double change, double changePercent) {
        public static final Change NONE = new Change(0.0, 0.0);
    }
}
