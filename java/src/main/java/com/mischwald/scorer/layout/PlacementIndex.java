package com.mischwald.scorer.layout;

import java.util.Optional;

/**
 * Inverse lookup from an instance to its tree and side.
 */
public class PlacementIndex {
    private final Placement[] placements;

    private PlacementIndex(Placement[] placements) {
        this.placements = placements;
    }

    public static PlacementIndex of(Forest forest) {
        Placement[] placements = new Placement[forest.size()];
        for (Tree tree : forest.getTrees()) {
            register(placements, tree.getAnchor(), new Placement(tree, null));
            for (Side side : new Side[] {Side.TOP, Side.BOTTOM, Side.LEFT, Side.RIGHT}) {
                Placement placement = new Placement(tree, side);
                for (CardInstance card : tree.side(side)) {
                    register(placements, card, placement);
                }
            }
        }
        return new PlacementIndex(placements);
    }

    private static void register(Placement[] placements, CardInstance card, Placement placement) {
        if (placements[card.getIndex()] == null) {
            placements[card.getIndex()] = placement;
        }
    }

    /**
     * Placement of the instance, empty if it is not part of any tree.
     */
    public Optional<Placement> get(CardInstance card) {
        int index = card.getIndex();
        if (index < 0 || index >= placements.length) {
            return Optional.empty();
        }
        return Optional.ofNullable(placements[index]);
    }

    public Optional<Tree> treeOf(CardInstance card) {
        return get(card).map(Placement::tree);
    }
}
