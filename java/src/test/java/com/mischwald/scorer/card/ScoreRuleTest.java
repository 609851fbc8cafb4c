package com.mischwald.scorer.card;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for table lookups and rule variants.
 */
class ScoreRuleTest {

    private final ScoreRule.Table table = new ScoreRule.Table(List.of(0, 3, 6, 12), null,
            Condition.builder().tags("Butterfly").unique().build());

    @Test
    void testTableIndexesByCount() {
        assertEquals(0, table.pointsFor(1));
        assertEquals(3, table.pointsFor(2));
        assertEquals(12, table.pointsFor(4));
    }

    @Test
    void testTableClampsLowCounts() {
        assertEquals(0, table.pointsFor(0));
        assertEquals(0, table.pointsFor(-3));
    }

    @Test
    void testTableReturnsLastEntryFromTableLengthUp() {
        for (int count = 4; count < 20; count++) {
            assertEquals(12, table.pointsFor(count));
        }
    }

    @Test
    void testEmptyTable() {
        assertEquals(0, new ScoreRule.Table(List.of(), null, null).pointsFor(3));
    }

    @Test
    void testRuleTypePerVariant() {
        assertEquals(RuleType.FIXED, new ScoreRule.Fixed(1, null, null).getRuleType());
        assertEquals(RuleType.MULTIPLICATION, new ScoreRule.Multiplication(1, null, null).getRuleType());
        assertEquals(RuleType.TABLE, table.getRuleType());
    }
}
