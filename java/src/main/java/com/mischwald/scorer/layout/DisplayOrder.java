package com.mischwald.scorer.layout;

import com.mischwald.scorer.geometry.Box;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.OptionalInt;

import static com.mischwald.scorer.layout.LayoutConstants.ADJACENT_EPSILON;

/**
 * Output order of a forest: trees in reading order, each followed by its top,
 * left, right and bottom cards, then everything else.
 */
public class DisplayOrder {
    private final List<CardInstance> instances;
    private final int[] treeNumbers;

    private DisplayOrder(List<CardInstance> instances, int[] treeNumbers) {
        this.instances = instances;
        this.treeNumbers = treeNumbers;
    }

    public static DisplayOrder of(Forest forest) {
        List<Tree> trees = readingOrder(forest.getTrees());
        List<CardInstance> sorted = new ArrayList<>(forest.size());
        boolean[] seen = new boolean[forest.size()];
        int[] treeNumbers = new int[forest.size()];

        for (int i = 0; i < trees.size(); i++) {
            Tree tree = trees.get(i);
            for (CardInstance member : tree.members()) {
                treeNumbers[member.getIndex()] = i + 1;
            }

            emit(tree.getAnchor(), sorted, seen);
            for (Side side : new Side[] {Side.TOP, Side.LEFT, Side.RIGHT, Side.BOTTOM}) {
                for (CardInstance card : sortAttached(tree, side)) {
                    emit(card, sorted, seen);
                }
            }
        }

        // attachments that failed the side re-check, then cards outside every tree
        for (Tree tree : forest.getTrees()) {
            for (CardInstance member : tree.members()) {
                emit(member, sorted, seen);
            }
        }
        for (CardInstance card : forest.getUnattached()) {
            emit(card, sorted, seen);
        }
        return new DisplayOrder(List.copyOf(sorted), treeNumbers);
    }

    private static void emit(CardInstance card, List<CardInstance> sorted, boolean[] seen) {
        if (!seen[card.getIndex()]) {
            seen[card.getIndex()] = true;
            sorted.add(card);
        }
    }

    /**
     * Sort trees row by row, left to right within a row.
     * Two trees share a row when their top edges are less than half the average tree height apart.
     */
    public static List<Tree> readingOrder(List<Tree> trees) {
        if (trees.isEmpty()) {
            return List.of();
        }
        double avgHeight = 0;
        for (Tree tree : trees) {
            avgHeight += tree.getAnchor().getBox().h();
        }
        avgHeight /= trees.size();
        double threshold = Math.max(avgHeight / 2, ADJACENT_EPSILON);

        List<Tree> byTop = new ArrayList<>(trees);
        byTop.sort(Comparator.comparingDouble(t -> t.getAnchor().getBox().y1()));

        List<Tree> result = new ArrayList<>(trees.size());
        List<Tree> row = new ArrayList<>();
        double rowTop = 0;
        for (Tree tree : byTop) {
            double top = tree.getAnchor().getBox().y1();
            if (!row.isEmpty() && Math.abs(top - rowTop) >= threshold) {
                flushRow(row, result);
            }
            if (row.isEmpty()) {
                rowTop = top;
            }
            row.add(tree);
        }
        flushRow(row, result);
        return result;
    }

    private static void flushRow(List<Tree> row, List<Tree> result) {
        row.sort(Comparator.comparingDouble(t -> t.getAnchor().getBox().x1()));
        result.addAll(row);
        row.clear();
    }

    /**
     * Cards of one side, nearest to the tree first, keeping only those geometrically on that side.
     */
    static List<CardInstance> sortAttached(Tree tree, Side side) {
        Box treeBox = tree.getAnchor().getBox();
        List<CardInstance> result = new ArrayList<>(tree.side(side));
        result.sort(attachedOrder(side));
        result.removeIf(card -> !side.edgeOnSide(card.getBox(), treeBox));
        return result;
    }

    private static Comparator<CardInstance> attachedOrder(Side side) {
        return switch (side) {
            case TOP -> Comparator.<CardInstance>comparingDouble(c -> c.getBox().y2()).reversed()
                    .thenComparingDouble(c -> c.getBox().cx());
            case BOTTOM -> Comparator.<CardInstance>comparingDouble(c -> c.getBox().y1())
                    .thenComparingDouble(c -> c.getBox().cx());
            case LEFT -> Comparator.<CardInstance>comparingDouble(c -> c.getBox().x2()).reversed()
                    .thenComparingDouble(c -> c.getBox().cy());
            case RIGHT -> Comparator.<CardInstance>comparingDouble(c -> c.getBox().x1())
                    .thenComparingDouble(c -> c.getBox().cy());
        };
    }

    /**
     * Instances in display order.
     */
    public List<CardInstance> getInstances() {
        return instances;
    }

    /**
     * 1-based reading-order number of the instance's tree, empty for unattached cards.
     */
    public OptionalInt treeNumber(CardInstance card) {
        int number = treeNumbers[card.getIndex()];
        return number > 0 ? OptionalInt.of(number) : OptionalInt.empty();
    }
}
