package com.mischwald.scorer.layout;

import com.mischwald.scorer.testing.TestCards;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.mischwald.scorer.testing.TestCards.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the instance to placement lookup.
 */
class PlacementIndexTest {

    private final Forest forest = new ForestBuilder(TestCards.db()).build(List.of(
            tree("beech:beech"),
            above("eurasian_jay:beech"),
            leftOf("red_deer:beech"),
            box("gnat:oak", 0.9, 0.05, 0.99, 0.2)));

    private final PlacementIndex index = PlacementIndex.of(forest);

    @Test
    void testAnchorHasNoSide() {
        Placement placement = index.get(forest.getInstance(0)).orElseThrow();
        assertTrue(placement.isAnchor());
        assertNull(placement.side());
        assertSame(forest.getTrees().get(0), placement.tree());
    }

    @Test
    void testAttachmentsKnowTheirSide() {
        assertEquals(Side.TOP, index.get(forest.getInstance(1)).orElseThrow().side());
        assertEquals(Side.LEFT, index.get(forest.getInstance(2)).orElseThrow().side());
        assertSame(forest.getTrees().get(0), index.treeOf(forest.getInstance(2)).orElseThrow());
    }

    @Test
    void testUnattachedHasNoPlacement() {
        assertTrue(index.get(forest.getInstance(3)).isEmpty());
        assertTrue(index.treeOf(forest.getInstance(3)).isEmpty());
    }
}
