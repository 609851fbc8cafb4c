package com.mischwald.scorer.layout;

import com.mischwald.scorer.geometry.Box;
import com.mischwald.scorer.testing.TestCards;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.mischwald.scorer.testing.TestCards.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for inferring trees from boxes.
 */
class ForestBuilderTest {

    private final ForestBuilder builder = new ForestBuilder(TestCards.db());

    private static List<String> labels(List<CardInstance> cards) {
        return cards.stream().map(CardInstance::getLabel).toList();
    }

    @Test
    void testPlacesCardsOnAllFourSides() {
        Forest forest = builder.build(List.of(
                tree("beech:beech"),
                above("eurasian_jay:beech"),
                below("wolf:beech"),
                leftOf("red_deer:beech"),
                rightOf("roe_deer:beech")));

        assertEquals(1, forest.getTrees().size());
        Tree tree = forest.getTrees().get(0);
        assertEquals("beech", tree.getAnchor().getEntityId());
        assertEquals(List.of("eurasian_jay:beech"), labels(tree.side(Side.TOP)));
        assertEquals(List.of("wolf:beech"), labels(tree.side(Side.BOTTOM)));
        assertEquals(List.of("red_deer:beech"), labels(tree.side(Side.LEFT)));
        assertEquals(List.of("roe_deer:beech"), labels(tree.side(Side.RIGHT)));
        assertTrue(tree.isFull());
        assertTrue(forest.getUnattached().isEmpty());
    }

    @Test
    void testThreeSidesIsNotFull() {
        Forest forest = builder.build(List.of(
                tree("beech:beech"),
                above("eurasian_jay:beech"),
                below("wolf:beech"),
                leftOf("red_deer:beech")));

        assertFalse(forest.getTrees().get(0).isFull());
    }

    @Test
    void testRejectsTooLittlePerpendicularOverlap() {
        Forest forest = builder.build(List.of(
                tree("birch:birch"),
                box("wolf:birch", 0.485, 0.24, 0.585, 0.39)));

        assertEquals(0, forest.getTrees().get(0).attachmentCount());
        assertEquals(List.of("wolf:birch"), labels(forest.getUnattached()));
    }

    @Test
    void testRejectsTooLargeGap() {
        Forest forest = builder.build(List.of(
                tree("birch:birch"),
                box("wolf:birch", 0.40, 0.63, 0.50, 0.78)));

        assertEquals(List.of("wolf:birch"), labels(forest.getUnattached()));
    }

    @Test
    void testRejectsCardOverlappingTheTree() {
        Forest forest = builder.build(List.of(
                tree("birch:birch"),
                box("wolf:birch", 0.40, 0.54, 0.50, 0.69)));

        assertEquals(List.of("wolf:birch"), labels(forest.getUnattached()));
    }

    @Test
    void testToleratesSlightOverlap() {
        Forest forest = builder.build(List.of(
                tree("birch:birch"),
                box("wolf:birch", 0.40, 0.549, 0.50, 0.699)));

        assertEquals(List.of("wolf:birch"), labels(forest.getTrees().get(0).side(Side.BOTTOM)));
    }

    @Test
    void testNearestTreeWins() {
        Forest forest = builder.build(List.of(
                box("oak:oak", 0.10, 0.40, 0.20, 0.55),
                box("birch:birch", 0.35, 0.40, 0.45, 0.55),
                box("wolf:oak", 0.23, 0.40, 0.33, 0.55)));

        Tree oak = forest.getTrees().get(0);
        Tree birch = forest.getTrees().get(1);
        assertEquals(0, oak.attachmentCount());
        assertEquals(List.of("wolf:oak"), labels(birch.side(Side.LEFT)));
    }

    @Test
    void testEqualGapGoesToLargerOverlap() {
        // wolf touches both trees; it shares its full height with birch but only half with oak
        Forest forest = builder.build(List.of(
                box("oak:oak", 0.125, 0.4375, 0.25, 0.5625),
                box("birch:birch", 0.375, 0.375, 0.5, 0.5),
                box("wolf:oak", 0.25, 0.375, 0.375, 0.5)));

        Tree oak = forest.getTrees().get(0);
        Tree birch = forest.getTrees().get(1);
        assertEquals(0, oak.attachmentCount());
        assertEquals(List.of("wolf:oak"), labels(birch.side(Side.LEFT)));
    }

    @Test
    void testNearlyEqualGapsJoinChainInOneRound() {
        Forest forest = builder.build(List.of(
                tree("birch:birch"),
                below("wolf:birch"),
                box("gnat:birch", 0.45, 0.7205, 0.55, 0.8705),
                box("mole:birch", 0.35, 0.72, 0.45, 0.87)));

        // gnat is slightly farther than mole but within epsilon, so input order is kept
        assertEquals(List.of("wolf:birch", "gnat:birch", "mole:birch"),
                labels(forest.getTrees().get(0).side(Side.BOTTOM)));
    }

    @Test
    void testPickDirectlyAdjacentKeepsTiesOnly() {
        Box link = below("wolf:birch");
        List<CardInstance> cards = List.of(
                new CardInstance(0, box("gnat:birch", 0.45, 0.7205, 0.55, 0.8705), "gnat", "birch", null),
                new CardInstance(1, box("mole:birch", 0.42, 0.74, 0.52, 0.89), "mole", "birch", null),
                new CardInstance(2, box("red_fox:birch", 0.35, 0.72, 0.45, 0.87), "red_fox", "birch", null));

        assertEquals(List.of("gnat:birch", "red_fox:birch"),
                labels(ForestBuilder.pickDirectlyAdjacent(link, cards, Side.BOTTOM)));
    }

    @Test
    void testChainExpandsBelowTree() {
        Forest forest = builder.build(List.of(
                tree("birch:birch"),
                box("gnat:birch", 0.40, 0.88, 0.50, 1.03),
                box("mole:birch", 0.40, 0.72, 0.50, 0.87),
                below("wolf:birch")));

        Tree tree = forest.getTrees().get(0);
        assertEquals(List.of("wolf:birch", "mole:birch", "gnat:birch"), labels(tree.side(Side.BOTTOM)));
        assertTrue(forest.getUnattached().isEmpty());
    }

    @Test
    void testChainExpandsToTheRight() {
        Forest forest = builder.build(List.of(
                tree("birch:birch"),
                rightOf("wolf:birch"),
                box("mole:birch", 0.62, 0.40, 0.72, 0.55)));

        assertEquals(List.of("wolf:birch", "mole:birch"), labels(forest.getTrees().get(0).side(Side.RIGHT)));
    }

    @Test
    void testChainNeedsOverlapWithLink() {
        Forest forest = builder.build(List.of(
                tree("birch:birch"),
                below("wolf:birch"),
                box("red_fox:birch", 0.30, 0.72, 0.40, 0.87),
                box("mole:birch", 0.40, 0.72, 0.50, 0.87)));

        assertEquals(List.of("wolf:birch", "mole:birch"), labels(forest.getTrees().get(0).side(Side.BOTTOM)));
        assertEquals(List.of("red_fox:birch"), labels(forest.getUnattached()));
    }

    @Test
    void testTreesAreNeverAttached() {
        Forest forest = builder.build(List.of(
                box("oak:oak", 0.10, 0.40, 0.20, 0.55),
                box("birch:birch", 0.21, 0.40, 0.31, 0.55)));

        assertEquals(2, forest.getTrees().size());
        assertEquals(0, forest.getTrees().get(0).attachmentCount());
        assertEquals(0, forest.getTrees().get(1).attachmentCount());
    }

    @Test
    void testMalformedLabelsAreDroppedAndUnknownIdsKept() {
        Forest forest = builder.build(List.of(
                box("nolabel", 0, 0, 1, 1),
                box("dodo:oak", 0.8, 0.8, 0.9, 0.9)));

        assertEquals(1, forest.size());
        assertEquals(0, forest.getInstance(0).getIndex());
        assertEquals(List.of("dodo:oak"), labels(forest.getUnattached()));
    }

    @Test
    void testMembersOrder() {
        Forest forest = builder.build(List.of(
                box("gnat:oak", 0.9, 0.05, 0.99, 0.2),
                below("wolf:beech"),
                tree("beech:beech"),
                rightOf("roe_deer:beech"),
                above("eurasian_jay:beech")));

        assertEquals(List.of("beech:beech", "eurasian_jay:beech", "roe_deer:beech", "wolf:beech", "gnat:oak"),
                labels(forest.members()));
        for (int i = 0; i < forest.size(); i++) {
            assertEquals(i, forest.getInstance(i).getIndex());
        }
    }

    @Test
    void testSideGapChecks() {
        Box anchor = tree("birch:birch");
        assertEquals(0.01, ForestBuilder.sideGap(below("wolf:birch"), anchor, Side.BOTTOM,
                ForestBuilder.SideCheck.CENTER).getAsDouble(), 1e-9);
        assertTrue(ForestBuilder.sideGap(below("wolf:birch"), anchor, Side.TOP,
                ForestBuilder.SideCheck.CENTER).isEmpty());
        assertTrue(ForestBuilder.sideGap(leftOf("wolf:birch"), anchor, Side.RIGHT,
                ForestBuilder.SideCheck.EDGE).isEmpty());
    }
}
