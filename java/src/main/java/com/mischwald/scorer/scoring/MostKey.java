package com.mischwald.scorer.scoring;

import com.mischwald.scorer.card.Condition;
import com.mischwald.scorer.layout.CardInstance;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Canonical identity of a "most" condition: what is counted, not where the counting card sits.
 *
 * @param ids sorted entity ids, empty when ids are not filtered
 * @param tags sorted tags, empty when tags are not filtered
 * @param unique whether distinct ids are counted
 * @param treeSymbol required tree symbol, or null
 */
public record MostKey(List<String> ids, List<String> tags, boolean unique, String treeSymbol) {

    public static MostKey of(CardInstance self, Condition condition) {
        return new MostKey(
                canonical(condition.getNames()),
                canonical(condition.getTags()),
                condition.isUnique(),
                condition.isSameTreeSymbol() ? self.getTreeSymbol() : null);
    }

    private static List<String> canonical(List<String> values) {
        List<String> result = new ArrayList<>();
        if (values != null) {
            for (String value : values) {
                if (value != null && !value.isEmpty()) {
                    result.add(value);
                }
            }
        }
        result.sort(null);
        return List.copyOf(result);
    }

    /**
     * Single-string form used as the cache key.
     */
    public String asString() {
        return String.join(",", ids) + "|" + String.join(",", tags) + "|" + unique + "|"
                + Objects.requireNonNullElse(treeSymbol, "");
    }
}
