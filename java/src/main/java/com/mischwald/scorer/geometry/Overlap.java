package com.mischwald.scorer.geometry;

/**
 * Interval overlap of boxes along a single axis.
 */
public final class Overlap {
    private Overlap() {}

    /**
     * Length of the intersection of both boxes' intervals on the axis, never negative.
     */
    public static double overlapAxis(Box a, Box b, Axis axis) {
        return Math.max(0, Math.min(a.end(axis), b.end(axis)) - Math.max(a.start(axis), b.start(axis)));
    }

    public static double horizontal(Box a, Box b) {
        return overlapAxis(a, b, Axis.HORIZONTAL);
    }

    public static double vertical(Box a, Box b) {
        return overlapAxis(a, b, Axis.VERTICAL);
    }
}
