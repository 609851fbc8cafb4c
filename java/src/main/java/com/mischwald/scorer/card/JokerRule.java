package com.mischwald.scorer.card;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Lets a card stand in for another card type when conditions filter by type.
 */
public class JokerRule {
    @JsonProperty("type")
    private String type;

    public JokerRule() {
    }

    public JokerRule(String type) {
        this.type = type;
    }

    public String getType() {
        return type;
    }
}
