package com.mischwald.scorer.scoring;

import com.mischwald.scorer.card.Condition;

import java.util.ArrayList;
import java.util.List;

/**
 * Wording of score explanations.
 */
final class ScoreReasons {
    private ScoreReasons() {}

    static final String NO_CONDITION = "0 (no condition)";

    static String pointsWord(int n) {
        return n == 1 ? "point" : "points";
    }

    static String matchesWord(int n) {
        return n == 1 ? "match" : "matches";
    }

    static String target(Condition condition) {
        List<String> ids = nonEmpty(condition.getNames());
        if (!ids.isEmpty()) {
            return String.join("/", ids);
        }
        List<String> tags = nonEmpty(condition.getTags());
        if (!tags.isEmpty()) {
            return String.join(" or ", tags);
        }
        return "cards";
    }

    static String scope(Condition condition) {
        return condition.isSameTree() ? "in the same tree" : "";
    }

    static String extras(Condition condition) {
        List<String> parts = new ArrayList<>();
        if (condition.isUnique()) parts.add("unique");
        if (condition.isSameTreeSymbol()) parts.add("same tree symbol");
        if (condition.isFullTree()) parts.add("full tree");
        if (condition.isSameSpot()) parts.add("same spot");
        if (condition.isMost()) parts.add("most");
        if (condition.getPosition() != null && !condition.getPosition().isEmpty()) {
            parts.add(String.join("/", condition.getPosition()));
        }
        return String.join(", ", parts);
    }

    /**
     * " (extras)" or "" when there are none.
     */
    static String extrasSuffix(Condition condition) {
        String extras = extras(condition);
        return extras.isEmpty() ? "" : " (" + extras + ")";
    }

    /**
     * " scope" or "" when the condition is not scoped.
     */
    static String scopeSuffix(Condition condition) {
        String scope = scope(condition);
        return scope.isEmpty() ? "" : " " + scope;
    }

    private static List<String> nonEmpty(List<String> values) {
        List<String> result = new ArrayList<>();
        if (values != null) {
            for (String value : values) {
                if (value != null && !value.isEmpty()) {
                    result.add(value);
                }
            }
        }
        return result;
    }
}
