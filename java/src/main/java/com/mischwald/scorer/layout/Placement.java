package com.mischwald.scorer.layout;

/**
 * Where an instance sits: its tree, and the side it is played on (null for the tree card itself).
 */
public record Placement(Tree tree, Side side) {

    public boolean isAnchor() {
        return side == null;
    }
}
