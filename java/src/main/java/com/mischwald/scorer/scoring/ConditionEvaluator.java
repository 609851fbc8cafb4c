package com.mischwald.scorer.scoring;

import com.mischwald.scorer.card.CardDefinition;
import com.mischwald.scorer.card.Condition;
import com.mischwald.scorer.card.RuleType;
import com.mischwald.scorer.card.ScoreRule;
import com.mischwald.scorer.geometry.Box;
import com.mischwald.scorer.geometry.Overlap;
import com.mischwald.scorer.layout.CardInstance;
import com.mischwald.scorer.layout.Forest;
import com.mischwald.scorer.layout.Placement;
import com.mischwald.scorer.layout.PlacementIndex;
import com.mischwald.scorer.layout.Tree;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Counts the cards of one player that satisfy a condition, seen from one card.
 */
public class ConditionEvaluator {
    public static final String POSITION_BELOW = "below";

    private final int playerIndex;
    private final List<CardInstance> cards;
    private final PlacementIndex placements;
    private final MostResolver mostResolver;
    private final TableGroups tableGroups;

    public ConditionEvaluator(int playerIndex, Forest forest, MostResolver mostResolver) {
        this.playerIndex = playerIndex;
        this.cards = forest.members();
        this.placements = PlacementIndex.of(forest);
        this.mostResolver = mostResolver;
        this.tableGroups = new TableGroups(forest.size());
    }

    /**
     * All of the player's instances, in scoring order.
     */
    public List<CardInstance> getCards() {
        return cards;
    }

    /**
     * Group every instance scored by a unique table condition, in scoring order,
     * before any of them is scored.
     */
    public void prepareTableGroups() {
        for (CardInstance card : cards) {
            ScoreRule rule = card.getScoreRule();
            if (isUniqueTable(rule) && !tableGroups.isGrouped(card)) {
                countMatches(card, rule.getCondition());
            }
        }
    }

    /**
     * Number of matches for the condition as seen from {@code self}.
     */
    public int countMatches(CardInstance self, Condition condition) {
        if (condition.isMost() && !mostResolver.isWinner(playerIndex, self, condition)) {
            return 0;
        }

        Optional<Placement> placement = placements.get(self);

        if (condition.isFullTree()) {
            return placement.map(Placement::tree).filter(Tree::isFull).isPresent() ? 1 : 0;
        }

        Optional<List<CardInstance>> pool = candidatePool(self, condition, placement);
        if (pool.isEmpty()) {
            return 0;
        }
        List<CardInstance> matching = filter(self, pool.get(), condition);

        if (condition.isUnique() && isTable(self.getScoreRule())) {
            OptionalInt grouped = tableGroups.groupSize(self);
            return grouped.isPresent() ? grouped.getAsInt() : tableGroups.assign(self, matching);
        }
        if (condition.isUnique()) {
            return distinctIds(matching);
        }
        return matching.size();
    }

    /**
     * Cards the condition looks at, or empty when {@code self} has no such scope.
     */
    Optional<List<CardInstance>> candidatePool(CardInstance self, Condition condition, Optional<Placement> placement) {
        if (condition.isSameTree()) {
            if (placement.isEmpty()) {
                return Optional.empty();
            }
            Tree tree = placement.get().tree();
            List<CardInstance> pool = new ArrayList<>();
            if (tree.getAnchor() != self) {
                pool.add(tree.getAnchor());
            }
            pool.addAll(tree.attachments());
            return Optional.of(pool);
        }
        if (condition.isSameSpot()) {
            if (placement.isEmpty() || placement.get().isAnchor()) {
                return Optional.empty();
            }
            return Optional.of(placement.get().tree().side(placement.get().side()));
        }
        if (condition.hasPosition(POSITION_BELOW)) {
            Box own = self.getBox();
            List<CardInstance> pool = new ArrayList<>();
            for (CardInstance card : cards) {
                Box other = card.getBox();
                if (other.y1() >= own.y2() && Overlap.horizontal(other, own) > 0) {
                    pool.add(card);
                }
            }
            return Optional.of(pool);
        }
        return Optional.of(cards);
    }

    static List<CardInstance> filter(CardInstance self, List<CardInstance> pool, Condition condition) {
        List<String> names = condition.getNames();
        List<String> tags = condition.getTags();
        String type = condition.getType();
        String treeSymbol = condition.isSameTreeSymbol() ? self.getTreeSymbol() : null;

        List<CardInstance> result = new ArrayList<>();
        for (CardInstance card : pool) {
            CardDefinition definition = card.getDefinition();
            if (type != null && definition != null && type.equals(definition.getJokerType())) {
                result.add(card);
                continue;
            }
            boolean idOk = names == null || names.contains(card.getEntityId());
            boolean tagsOk = tags == null || (definition != null && tags.stream().anyMatch(definition::hasTag));
            boolean typeOk = type == null || (definition != null && type.equals(definition.getType()));
            boolean symbolOk = treeSymbol == null || treeSymbol.equals(card.getTreeSymbol());
            if (idOk && tagsOk && typeOk && symbolOk) {
                result.add(card);
            }
        }
        return result;
    }

    private static int distinctIds(List<CardInstance> matching) {
        Set<String> ids = new LinkedHashSet<>();
        for (CardInstance card : matching) {
            if (!card.isJoker()) {
                ids.add(card.getEntityId());
            }
        }
        return ids.size();
    }

    private static boolean isTable(ScoreRule rule) {
        return rule != null && rule.getRuleType() == RuleType.TABLE;
    }

    private static boolean isUniqueTable(ScoreRule rule) {
        return isTable(rule) && rule.hasCondition() && rule.getCondition().isUnique();
    }
}
