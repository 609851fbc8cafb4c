package com.mischwald.scorer.geometry;

/**
 * Axis-aligned bounding box of one detected card with its raw label.
 * Center and size are carried as detected; {@link #of} derives them from the corners.
 */
public record Box(
    double x1,
    double y1,
    double x2,
    double y2,
    double cx,
    double cy,
    double w,
    double h,
    String label
) {
    /**
     * Build a box from its corners, deriving center and size.
     */
    public static Box of(double x1, double y1, double x2, double y2, String label) {
        double w = x2 - x1;
        double h = y2 - y1;
        return new Box(x1, y1, x2, y2, x1 + w / 2, y1 + h / 2, w, h, label);
    }

    public double start(Axis axis) {
        return axis == Axis.HORIZONTAL ? x1 : y1;
    }

    public double end(Axis axis) {
        return axis == Axis.HORIZONTAL ? x2 : y2;
    }

    public double size(Axis axis) {
        return axis == Axis.HORIZONTAL ? w : h;
    }

    public double center(Axis axis) {
        return axis == Axis.HORIZONTAL ? cx : cy;
    }
}
