package com.mischwald.scorer.scoring;

import com.mischwald.scorer.card.CardDefinition;
import com.mischwald.scorer.card.Condition;
import com.mischwald.scorer.layout.CardInstance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Decides "most" conditions across all players of one scoring run.
 * Every player's layout must be built before the first question is asked;
 * a resolver instance must not outlive the run it was created for.
 */
public class MostResolver {
    private static final Logger LOG = LoggerFactory.getLogger(MostResolver.class);

    /**
     * Highest count for a key and the players reaching it.
     */
    public record Outcome(int max, Set<Integer> winners) {}

    private final List<List<CardInstance>> playerCards;
    private final Map<String, Outcome> cache = new HashMap<>();

    /**
     * @param playerCards every instance of each player, indexed by player
     */
    public MostResolver(List<List<CardInstance>> playerCards) {
        this.playerCards = List.copyOf(playerCards);
    }

    /**
     * Whether the player is among those with the highest count for this condition.
     */
    public boolean isWinner(int playerIndex, CardInstance self, Condition condition) {
        if (!condition.isMost()) {
            return true;
        }
        return outcome(MostKey.of(self, condition), condition).winners().contains(playerIndex);
    }

    /**
     * Outcome for a key, computed on first use. The condition's type filter is taken
     * from the first condition asking for the key.
     */
    public Outcome outcome(MostKey key, Condition condition) {
        return cache.computeIfAbsent(key.asString(), ks -> {
            List<Integer> counts = new ArrayList<>(playerCards.size());
            int max = 0;
            for (List<CardInstance> cards : playerCards) {
                int count = countFor(key, cards, condition.getType());
                counts.add(count);
                max = Math.max(max, count);
            }
            Set<Integer> winners = new LinkedHashSet<>();
            if (max > 0) {
                for (int i = 0; i < counts.size(); i++) {
                    if (counts.get(i) == max) {
                        winners.add(i);
                    }
                }
            }
            LOG.debug("Most [{}]: counts={} max={} winners={}", ks, counts, max, winners);
            return new Outcome(max, Set.copyOf(winners));
        });
    }

    static int countFor(MostKey key, List<CardInstance> cards, String type) {
        List<CardInstance> filtered = new ArrayList<>();
        for (CardInstance card : cards) {
            if (matches(key, card, type)) {
                filtered.add(card);
            }
        }
        if (!key.unique()) {
            return filtered.size();
        }
        Set<String> ids = new LinkedHashSet<>();
        for (CardInstance card : filtered) {
            if (!card.isJoker()) {
                ids.add(card.getEntityId());
            }
        }
        return ids.size();
    }

    private static boolean matches(MostKey key, CardInstance card, String type) {
        if (key.treeSymbol() != null && !key.treeSymbol().equals(card.getTreeSymbol())) {
            return false;
        }
        CardDefinition definition = card.getDefinition();
        boolean idOk = key.ids().isEmpty() || key.ids().contains(card.getEntityId());
        boolean tagsOk = key.tags().isEmpty()
                || (definition != null && key.tags().stream().anyMatch(definition::hasTag));
        boolean typeOk = type == null || (definition != null && type.equals(definition.getType()));
        return idOk && tagsOk && typeOk;
    }
}
