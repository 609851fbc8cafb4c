package com.mischwald.scorer.layout;

import com.mischwald.scorer.card.CardDatabase;
import com.mischwald.scorer.geometry.Axis;
import com.mischwald.scorer.geometry.Box;
import com.mischwald.scorer.geometry.Overlap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;

import static com.mischwald.scorer.layout.LayoutConstants.*;

/**
 * Infers a forest from a flat set of detected boxes.
 *
 * <p>Phase 1 places every non-tree card on the closest side of the closest tree it
 * is directly beside. Phase 2 grows each side outwards: a card that is beside any
 * card already on that side joins it, round after round, so a whole column of
 * cards stacked below a tree ends up on its bottom side.
 */
public class ForestBuilder {
    private static final Logger LOG = LoggerFactory.getLogger(ForestBuilder.class);

    private static final Side[] PLACEMENT_ORDER = {Side.TOP, Side.LEFT, Side.RIGHT, Side.BOTTOM};
    private static final Side[] EXPANSION_ORDER = {Side.TOP, Side.BOTTOM, Side.LEFT, Side.RIGHT};

    private final CardInstanceResolver resolver;

    public ForestBuilder(CardDatabase db) {
        this(new CardInstanceResolver(db));
    }

    public ForestBuilder(CardInstanceResolver resolver) {
        this.resolver = resolver;
    }

    /**
     * Candidate side of a tree for one card.
     */
    record PlacementCandidate(Tree tree, Side side, double gap, double overlap) {

        boolean isBetterThan(PlacementCandidate other) {
            return other == null
                    || gap < other.gap
                    || (gap == other.gap && overlap > other.overlap);
        }
    }

    /**
     * How a card must relate to its neighbour to count as being on a side.
     */
    enum SideCheck {
        /** Center of the card beyond the center of the tree. */
        CENTER,
        /** Card entirely beyond the neighbour's edge. */
        EDGE
    }

    /**
     * Build the forest for one player's boxes.
     */
    public Forest build(List<Box> boxes) {
        List<CardInstance> instances = new ArrayList<>(boxes.size());
        List<Tree> trees = new ArrayList<>();
        List<CardInstance> cards = new ArrayList<>();

        for (Box box : boxes) {
            Optional<CardInstance> resolved = resolver.resolve(box, instances.size());
            if (resolved.isEmpty()) {
                continue;
            }
            CardInstance instance = resolved.get();
            instances.add(instance);
            if (resolver.isAnchor(box)) {
                trees.add(new Tree(instance));
            } else {
                cards.add(instance);
            }
        }

        boolean[] placed = new boolean[instances.size()];

        // Phase 1: direct placement
        for (CardInstance card : cards) {
            PlacementCandidate best = null;
            for (Tree tree : trees) {
                PlacementCandidate candidate = bestPlacementCandidate(card, tree);
                if (candidate != null && candidate.isBetterThan(best)) {
                    best = candidate;
                }
            }
            if (best != null) {
                best.tree().attach(best.side(), card);
                placed[card.getIndex()] = true;
            }
        }

        // Phase 2: chain expansion for indirectly adjacent cards
        List<CardInstance> remaining = new ArrayList<>();
        for (CardInstance card : cards) {
            if (!placed[card.getIndex()]) {
                remaining.add(card);
            }
        }
        for (Tree tree : trees) {
            for (Side side : EXPANSION_ORDER) {
                expandSideChain(tree, side, remaining);
            }
        }

        Forest forest = new Forest(instances, trees);
        LOG.debug("Built forest: {} trees, {} instances, {} unattached",
                trees.size(), instances.size(), forest.getUnattached().size());
        return forest;
    }

    /**
     * Best side of one tree for the card, or null if the card is beside none of them.
     */
    static PlacementCandidate bestPlacementCandidate(CardInstance card, Tree tree) {
        Box cardBox = card.getBox();
        Box treeBox = tree.getAnchor().getBox();
        PlacementCandidate best = null;

        for (Side side : PLACEMENT_ORDER) {
            OptionalDouble gap = sideGap(cardBox, treeBox, side, SideCheck.CENTER);
            if (gap.isEmpty()) {
                continue;
            }
            double overlap = Overlap.overlapAxis(cardBox, treeBox, side.perpendicularAxis());
            PlacementCandidate candidate = new PlacementCandidate(tree, side, gap.getAsDouble(), overlap);
            if (candidate.isBetterThan(best)) {
                best = candidate;
            }
        }
        return best;
    }

    /**
     * Clamped gap between card and neighbour on the given side, or empty when the
     * card is not beside the neighbour on that side.
     */
    static OptionalDouble sideGap(Box card, Box neighbour, Side side, SideCheck check) {
        Axis across = side.perpendicularAxis();
        Axis along = side.placementAxis();

        double perpOverlap = Overlap.overlapAxis(card, neighbour, across);
        double minPerpSize = Math.max(ADJACENT_EPSILON, Math.min(neighbour.size(across), card.size(across)));
        if (perpOverlap < minPerpSize * MIN_PERP_OVERLAP_RATIO) {
            return OptionalDouble.empty();
        }

        double rawGap = side.rawGap(card, neighbour);
        if (rawGap < -SIDE_OVERLAP_TOLERANCE) {
            return OptionalDouble.empty();
        }
        double gap = Math.max(0, rawGap);

        boolean onSide = check == SideCheck.CENTER
                ? side.centerOnSide(card, neighbour)
                : side.edgeOnSide(card, neighbour);
        if (!onSide) {
            return OptionalDouble.empty();
        }

        double maxGap = Math.max(ADJACENT_EPSILON, Math.max(neighbour.size(along), card.size(along)))
                * MAX_SIDE_GAP_RATIO;
        if (gap > maxGap) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(gap);
    }

    /**
     * Cards directly beside the link on the given side, keeping only those tied for the smallest gap.
     */
    static List<CardInstance> pickDirectlyAdjacent(Box link, List<CardInstance> cards, Side side) {
        List<CardInstance> candidates = new ArrayList<>();
        List<Double> gaps = new ArrayList<>();
        double minGap = Double.POSITIVE_INFINITY;

        for (CardInstance card : cards) {
            OptionalDouble gap = sideGap(card.getBox(), link, side, SideCheck.EDGE);
            if (gap.isEmpty()) {
                continue;
            }
            candidates.add(card);
            gaps.add(gap.getAsDouble());
            minGap = Math.min(minGap, gap.getAsDouble());
        }

        List<CardInstance> result = new ArrayList<>();
        for (int i = 0; i < candidates.size(); i++) {
            if (gaps.get(i) <= minGap + ADJACENT_EPSILON) {
                result.add(candidates.get(i));
            }
        }
        return result;
    }

    private static void expandSideChain(Tree tree, Side side, List<CardInstance> remaining) {
        List<Box> chain = new ArrayList<>();
        chain.add(tree.getAnchor().getBox());
        for (CardInstance attached : tree.side(side)) {
            chain.add(attached.getBox());
        }

        while (true) {
            Set<CardInstance> next = new LinkedHashSet<>();
            for (Box link : chain) {
                next.addAll(pickDirectlyAdjacent(link, remaining, side));
            }
            if (next.isEmpty()) {
                break;
            }
            for (CardInstance card : next) {
                if (remaining.remove(card)) {
                    tree.attach(side, card);
                    chain.add(card.getBox());
                }
            }
        }
    }
}
