package com.mischwald.scorer.layout;

/**
 * Tolerances used when inferring a forest from boxes.
 * All values are in the normalized coordinate space of the detector.
 */
public final class LayoutConstants {
    private LayoutConstants() {}

    /** Slack for "touching" edge checks and distance ties. */
    public static final double ADJACENT_EPSILON = 1e-3;

    /** How far a card may overlap its neighbour and still count as beside it. */
    public static final double SIDE_OVERLAP_TOLERANCE = 2e-3;

    /** Minimum overlap across the placement axis, relative to the smaller card. */
    public static final double MIN_PERP_OVERLAP_RATIO = 0.20;

    /** Maximum gap along the placement axis, relative to the larger card. */
    public static final double MAX_SIDE_GAP_RATIO = 0.50;
}
