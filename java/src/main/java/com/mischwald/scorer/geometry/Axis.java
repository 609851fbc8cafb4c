package com.mischwald.scorer.geometry;

/**
 * Image axes in the normalized coordinate space.
 */
public enum Axis {
    /** x, growing to the right. */
    HORIZONTAL,
    /** y, growing downwards. */
    VERTICAL;

    public Axis perpendicular() {
        return this == HORIZONTAL ? VERTICAL : HORIZONTAL;
    }
}
