package com.mischwald.scorer.scoring;

import com.mischwald.scorer.api.CardScoreDetail;
import com.mischwald.scorer.api.DetectedCard;
import com.mischwald.scorer.api.PlayerInput;
import com.mischwald.scorer.api.PlayerScoreResult;
import com.mischwald.scorer.geometry.Box;
import com.mischwald.scorer.layout.Forest;
import com.mischwald.scorer.layout.ForestBuilder;
import com.mischwald.scorer.testing.TestCards;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.mischwald.scorer.testing.TestCards.card;
import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end scoring of whole games.
 */
class MischwaldScorerTest {

    private final MischwaldScorer scorer = new MischwaldScorer(TestCards.db());

    private static PlayerInput player(String name, DetectedCard... cards) {
        return new PlayerInput(name, List.of(cards));
    }

    /** Cards in a single row, far enough apart to stay unattached unless they are trees. */
    private static PlayerInput row(String name, String... labels) {
        List<DetectedCard> cards = new ArrayList<>();
        for (int i = 0; i < labels.length; i++) {
            cards.add(card(labels[i], i * 0.12, 0.0, i * 0.12 + 0.1, 0.15));
        }
        return new PlayerInput(name, cards);
    }

    private static PlayerInput fullBeech(String name) {
        return player(name,
                card("beech:beech", 0.40, 0.40, 0.50, 0.55),
                card("eurasian_jay:beech", 0.40, 0.24, 0.50, 0.39),
                card("wolf:beech", 0.40, 0.56, 0.50, 0.71),
                card("mole:beech", 0.40, 0.72, 0.50, 0.87),
                card("red_deer:beech", 0.29, 0.40, 0.39, 0.55),
                card("roe_deer:beech", 0.51, 0.40, 0.61, 0.55),
                card("gnat:oak", 0.90, 0.90, 0.99, 0.99));
    }

    private static List<String> ids(PlayerScoreResult result) {
        List<String> ids = new ArrayList<>();
        for (CardScoreDetail detail : result.cardDetails()) {
            ids.add(detail.cardId());
        }
        return ids;
    }

    private static List<Integer> points(PlayerScoreResult result) {
        List<Integer> points = new ArrayList<>();
        for (CardScoreDetail detail : result.cardDetails()) {
            points.add(detail.points());
        }
        return points;
    }

    @Test
    void testFullTreeLayout() {
        PlayerScoreResult result = scorer.score(List.of(fullBeech("Alice"))).get(0);

        assertEquals("Alice", result.name());
        assertEquals(32, result.totalScore());
        assertEquals(List.of("beech:beech", "eurasian_jay:beech", "red_deer:beech", "roe_deer:beech",
                "wolf:beech", "mole:beech", "gnat:oak"), ids(result));
        assertEquals(List.of(0, 3, 1, 18, 10, 0, 0), points(result));

        CardScoreDetail jay = result.cardDetails().get(1);
        assertEquals("eurasian_jay", jay.title());
        assertEquals("Structure 1", jay.group());
        assertEquals("3 fixed points (1 match, at least 1 cards (full tree))", jay.reason());

        CardScoreDetail gnat = result.cardDetails().get(6);
        assertNull(gnat.group());
        assertEquals(ScoreResult.NO_EFFECT, gnat.reason());
    }

    @Test
    void testUnknownCardHasNoEffect() {
        CardScoreDetail detail = scorer.score(List.of(row("Ann", "dodo:oak"))).get(0).cardDetails().get(0);

        assertEquals("dodo:oak", detail.cardId());
        assertEquals("dodo", detail.title());
        assertEquals(0, detail.points());
        assertEquals(ScoreResult.NO_EFFECT, detail.reason());
        assertNull(detail.group());
    }

    @Test
    void testTwoTreesSideBySide() {
        PlayerScoreResult result = scorer.score(List.of(player("Bea",
                card("oak:oak", 0.10, 0.40, 0.30, 0.70),
                card("wolf:oak", 0.31, 0.40, 0.50, 0.70),
                card("birch:birch", 0.60, 0.40, 0.80, 0.70),
                card("wolf:birch", 0.81, 0.40, 0.99, 0.70)))).get(0);

        assertEquals(1, result.totalScore());
        assertEquals(List.of("oak:oak", "wolf:oak", "birch:birch", "wolf:birch"), ids(result));
        assertEquals("Structure 1", result.cardDetails().get(1).group());
        assertEquals("Structure 2", result.cardDetails().get(3).group());
    }

    @Test
    void testEmptyPlayer() {
        PlayerScoreResult result = scorer.score(List.of(player("Nobody"))).get(0);

        assertEquals("Nobody", result.name());
        assertEquals(0, result.totalScore());
        assertTrue(result.cardDetails().isEmpty());
    }

    @Test
    void testFoxCountsHares() {
        PlayerScoreResult result = scorer.score(List.of(row("Dan",
                "red_fox:oak", "european_hare:oak", "european_hare:oak", "european_hare:oak",
                "european_hare:oak"))).get(0);

        assertEquals(List.of(12, 4, 4, 4, 4), points(result));
        assertEquals(28, result.totalScore());
    }

    @Test
    void testJokerCountsAsHare() {
        PlayerScoreResult result = scorer.score(List.of(row("Eve",
                "european_hare:oak", "snowshoe_hare:oak", "red_fox:oak"))).get(0);

        assertEquals(List.of(2, 2, 3), points(result));
        assertEquals(7, result.totalScore());
    }

    @Test
    void testMostAcrossPlayers() {
        List<PlayerScoreResult> results = scorer.score(List.of(
                row("P1", "linden:linden", "linden:linden"),
                row("P2", "linden:linden", "linden:linden"),
                row("P3", "linden:linden")));

        assertEquals(6, results.get(0).totalScore());
        assertEquals(6, results.get(1).totalScore());
        assertEquals(0, results.get(2).totalScore());
    }

    @Test
    void testResultsKeepInputOrder() {
        List<PlayerScoreResult> results = scorer.score(List.of(
                row("Zed", "birch:birch"), player("Amy"), row("Kim", "mole:oak")));

        assertEquals(List.of("Zed", "Amy", "Kim"),
                List.of(results.get(0).name(), results.get(1).name(), results.get(2).name()));
    }

    @Test
    void testMalformedLabelsAreDropped() {
        PlayerScoreResult result = scorer.score(List.of(row("Max", "birch", "birch:birch"))).get(0);

        assertEquals(List.of("birch:birch"), ids(result));
        assertEquals(1, result.totalScore());
    }

    @Test
    void testFailingLayoutScoresPlayerAsEmpty() {
        ForestBuilder failing = new ForestBuilder(TestCards.db()) {
            @Override
            public Forest build(List<Box> boxes) {
                if (boxes.stream().anyMatch(b -> b.label().startsWith("wolf"))) {
                    throw new IllegalStateException("boom");
                }
                return super.build(boxes);
            }
        };
        List<PlayerScoreResult> results = new MischwaldScorer(failing, new ScoreEngine()).score(List.of(
                row("Broken", "wolf:oak"), row("Fine", "birch:birch")));

        assertEquals(0, results.get(0).totalScore());
        assertTrue(results.get(0).cardDetails().isEmpty());
        assertEquals(1, results.get(1).totalScore());
    }

    @Test
    void testDeterministic() {
        List<PlayerInput> game = List.of(fullBeech("A"),
                row("B", "linden:linden", "violet:oak", "peacock_butterfly:oak", "camberwell_beauty:oak"),
                row("C", "linden:linden", "violet:oak", "violet:oak"));

        List<PlayerScoreResult> first = scorer.score(game);
        for (int i = 0; i < 5; i++) {
            assertEquals(first, new MischwaldScorer(TestCards.db()).score(game));
        }
    }
}
