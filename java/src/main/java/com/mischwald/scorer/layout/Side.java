package com.mischwald.scorer.layout;

import com.mischwald.scorer.geometry.Axis;
import com.mischwald.scorer.geometry.Box;

import static com.mischwald.scorer.layout.LayoutConstants.ADJACENT_EPSILON;

/**
 * The four sides of a tree a card can be played on.
 */
public enum Side {
    TOP(Axis.VERTICAL),
    BOTTOM(Axis.VERTICAL),
    LEFT(Axis.HORIZONTAL),
    RIGHT(Axis.HORIZONTAL);

    private final Axis placementAxis;

    Side(Axis placementAxis) {
        this.placementAxis = placementAxis;
    }

    /**
     * Axis along which cards on this side stack away from the anchor.
     */
    public Axis placementAxis() {
        return placementAxis;
    }

    /**
     * Axis across which a card must overlap its anchor.
     */
    public Axis perpendicularAxis() {
        return placementAxis.perpendicular();
    }

    /**
     * Signed gap between the anchor's edge on this side and the facing edge of the card.
     * Negative when the boxes overlap.
     */
    public double rawGap(Box card, Box anchor) {
        return switch (this) {
            case TOP -> anchor.y1() - card.y2();
            case BOTTOM -> card.y1() - anchor.y2();
            case LEFT -> anchor.x1() - card.x2();
            case RIGHT -> card.x1() - anchor.x2();
        };
    }

    /**
     * Whether the card's center lies on this side of the anchor's center.
     */
    public boolean centerOnSide(Box card, Box anchor) {
        return switch (this) {
            case TOP -> card.cy() <= anchor.cy();
            case BOTTOM -> card.cy() >= anchor.cy();
            case LEFT -> card.cx() <= anchor.cx();
            case RIGHT -> card.cx() >= anchor.cx();
        };
    }

    /**
     * Whether the card lies entirely beyond the anchor's edge on this side, within epsilon.
     */
    public boolean edgeOnSide(Box card, Box anchor) {
        return switch (this) {
            case TOP -> card.y2() <= anchor.y1() + ADJACENT_EPSILON;
            case BOTTOM -> card.y1() >= anchor.y2() - ADJACENT_EPSILON;
            case LEFT -> card.x2() <= anchor.x1() + ADJACENT_EPSILON;
            case RIGHT -> card.x1() >= anchor.x2() - ADJACENT_EPSILON;
        };
    }
}
