package com.mischwald.scorer.api;

import com.mischwald.scorer.geometry.Box;

/**
 * One card as reported by the recognizer.
 *
 * @param cardId label of the form {@code <entityId>:<treeSymbol>}
 * @param similarity recognizer confidence, not used for scoring
 */
public record DetectedCard(
    String cardId,
    double similarity,
    double x1,
    double y1,
    double x2,
    double y2,
    double cx,
    double cy,
    double w,
    double h
) {
    /**
     * Build a detected card from its corners, deriving center and size.
     */
    public static DetectedCard of(String cardId, double x1, double y1, double x2, double y2) {
        double w = x2 - x1;
        double h = y2 - y1;
        return new DetectedCard(cardId, 1.0, x1, y1, x2, y2, x1 + w / 2, y1 + h / 2, w, h);
    }

    /**
     * Box used for layout. Center and size are taken as detected; inputs that leave
     * the size out get them derived from the corners.
     */
    public Box toBox() {
        if (w > 0 && h > 0) {
            return new Box(x1, y1, x2, y2, cx, cy, w, h, cardId);
        }
        return Box.of(x1, y1, x2, y2, cardId);
    }
}
