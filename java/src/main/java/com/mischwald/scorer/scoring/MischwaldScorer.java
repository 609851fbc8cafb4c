package com.mischwald.scorer.scoring;

import com.mischwald.scorer.api.CardScoreDetail;
import com.mischwald.scorer.api.DetectedCard;
import com.mischwald.scorer.api.PlayerInput;
import com.mischwald.scorer.api.PlayerScoreResult;
import com.mischwald.scorer.card.CardDatabase;
import com.mischwald.scorer.geometry.Box;
import com.mischwald.scorer.layout.CardInstance;
import com.mischwald.scorer.layout.DisplayOrder;
import com.mischwald.scorer.layout.Forest;
import com.mischwald.scorer.layout.ForestBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

/**
 * Scores all players of one game.
 *
 * <p>Runs in two passes: every player's forest is built first, because "most"
 * conditions compare players and a later player's layout can change an earlier
 * player's points. Only then is each player scored.
 */
public class MischwaldScorer {
    private static final Logger LOG = LoggerFactory.getLogger(MischwaldScorer.class);

    public static final String GROUP_PREFIX = "Structure ";

    private final ForestBuilder forestBuilder;
    private final ScoreEngine scoreEngine;

    public MischwaldScorer(CardDatabase db) {
        this(new ForestBuilder(db), new ScoreEngine());
    }

    public MischwaldScorer(ForestBuilder forestBuilder, ScoreEngine scoreEngine) {
        this.forestBuilder = forestBuilder;
        this.scoreEngine = scoreEngine;
    }

    /**
     * Score every player; results are in input order.
     */
    public List<PlayerScoreResult> score(List<PlayerInput> players) {
        // Pass 1: layouts
        List<Forest> forests = new ArrayList<>(players.size());
        List<List<CardInstance>> playerCards = new ArrayList<>(players.size());
        for (PlayerInput player : players) {
            Forest forest = buildForest(player);
            forests.add(forest);
            playerCards.add(forest.members());
        }

        // Pass 2: scores, sharing one "most" cache for this run only
        MostResolver mostResolver = new MostResolver(playerCards);
        List<PlayerScoreResult> results = new ArrayList<>(players.size());
        for (int i = 0; i < players.size(); i++) {
            results.add(scorePlayer(i, players.get(i).name(), forests.get(i), mostResolver));
        }
        return results;
    }

    private Forest buildForest(PlayerInput player) {
        if (player.cards().isEmpty()) {
            return Forest.empty();
        }
        List<Box> boxes = new ArrayList<>(player.cards().size());
        for (DetectedCard card : player.cards()) {
            boxes.add(card.toBox());
        }
        try {
            return forestBuilder.build(boxes);
        } catch (RuntimeException e) {
            LOG.warn("Could not build layout for player '{}', scoring it as empty", player.name(), e);
            return Forest.empty();
        }
    }

    private PlayerScoreResult scorePlayer(int playerIndex, String name, Forest forest, MostResolver mostResolver) {
        if (forest.isEmpty()) {
            return PlayerScoreResult.empty(name);
        }

        ConditionEvaluator evaluator = new ConditionEvaluator(playerIndex, forest, mostResolver);
        evaluator.prepareTableGroups();

        ScoreResult[] scores = new ScoreResult[forest.size()];
        for (CardInstance card : evaluator.getCards()) {
            scores[card.getIndex()] = scoreEngine.score(card, evaluator);
        }

        DisplayOrder order = DisplayOrder.of(forest);
        List<CardScoreDetail> details = new ArrayList<>(forest.size());
        int total = 0;
        for (CardInstance card : order.getInstances()) {
            ScoreResult score = scores[card.getIndex()];
            OptionalInt treeNumber = order.treeNumber(card);
            String group = treeNumber.isPresent() ? GROUP_PREFIX + treeNumber.getAsInt() : null;
            details.add(new CardScoreDetail(card.getLabel(), score.points(), score.reason(), card.getEntityId(), group));
            total += score.points();
        }
        LOG.debug("Player '{}': {} cards, {} points", name, details.size(), total);
        return new PlayerScoreResult(name, total, details);
    }
}
