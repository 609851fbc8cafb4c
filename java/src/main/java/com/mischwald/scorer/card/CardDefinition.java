package com.mischwald.scorer.card;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Static definition of one card, as listed in the card file.
 */
public class CardDefinition {
    @JsonProperty("id")
    private String id;

    @JsonProperty("tags")
    private List<String> tags = List.of();

    @JsonProperty("type")
    private String type;

    @JsonProperty("score")
    private ScoreRule score;

    @JsonProperty("joker")
    private JokerRule joker;

    public CardDefinition() {
    }

    public CardDefinition(String id, List<String> tags, String type, ScoreRule score, JokerRule joker) {
        this.id = id;
        this.tags = tags != null ? List.copyOf(tags) : List.of();
        this.type = type;
        this.score = score;
        this.joker = joker;
    }

    public String getId() {
        return id;
    }

    public List<String> getTags() {
        return tags != null ? tags : List.of();
    }

    public boolean hasTag(String tag) {
        return getTags().contains(tag);
    }

    public String getType() {
        return type;
    }

    public ScoreRule getScore() {
        return score;
    }

    public JokerRule getJoker() {
        return joker;
    }

    public boolean isJoker() {
        return joker != null;
    }

    /**
     * Type this card stands in for, or null if it is not a joker.
     */
    public String getJokerType() {
        return joker != null ? joker.getType() : null;
    }
}
