package com.mischwald.scorer.card;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Properties shared by all score rule variants.
 */
public abstract class BaseScoreRule {
    @JsonProperty("min")
    private Integer min;

    @JsonProperty("condition")
    private Condition condition;

    protected BaseScoreRule() {
    }

    protected BaseScoreRule(Integer min, Condition condition) {
        this.min = min;
        this.condition = condition;
    }

    /**
     * Minimum match count, or null when the rule does not declare one.
     */
    public Integer getMin() {
        return min;
    }

    /**
     * Condition counted by this rule, or null for unconditional rules.
     */
    public Condition getCondition() {
        return condition;
    }

    public boolean hasCondition() {
        return condition != null;
    }
}
