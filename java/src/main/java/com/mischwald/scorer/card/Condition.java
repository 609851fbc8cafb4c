package com.mischwald.scorer.card;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Declarative filter counted by a score rule.
 * Names and tags are alternatives within their list; every given filter must hold.
 */
public class Condition {
    @JsonProperty("name")
    private List<String> names;

    @JsonProperty("tags")
    private List<String> tags;

    @JsonProperty("type")
    private String type;

    @JsonProperty("unique")
    private boolean unique;

    @JsonProperty("sameTree")
    private boolean sameTree;

    @JsonProperty("sameTreeSymbol")
    private boolean sameTreeSymbol;

    @JsonProperty("fullTree")
    private boolean fullTree;

    @JsonProperty("most")
    private boolean most;

    @JsonProperty("sameSpot")
    private boolean sameSpot;

    @JsonProperty("position")
    @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
    private List<String> position;

    public Condition() {
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Entity ids to match, or null when ids are not filtered.
     */
    public List<String> getNames() {
        return names;
    }

    /**
     * Tags of which at least one must be present, or null when tags are not filtered.
     */
    public List<String> getTags() {
        return tags;
    }

    public String getType() {
        return type;
    }

    public boolean isUnique() {
        return unique;
    }

    public boolean isSameTree() {
        return sameTree;
    }

    public boolean isSameTreeSymbol() {
        return sameTreeSymbol;
    }

    public boolean isFullTree() {
        return fullTree;
    }

    public boolean isMost() {
        return most;
    }

    public boolean isSameSpot() {
        return sameSpot;
    }

    public List<String> getPosition() {
        return position;
    }

    public boolean hasPosition(String value) {
        return position != null && position.contains(value);
    }

    public static final class Builder {
        private final Condition condition = new Condition();

        public Builder names(String... names) {
            condition.names = new ArrayList<>(List.of(names));
            return this;
        }

        public Builder tags(String... tags) {
            condition.tags = new ArrayList<>(List.of(tags));
            return this;
        }

        public Builder type(String type) {
            condition.type = type;
            return this;
        }

        public Builder unique() {
            condition.unique = true;
            return this;
        }

        public Builder sameTree() {
            condition.sameTree = true;
            return this;
        }

        public Builder sameTreeSymbol() {
            condition.sameTreeSymbol = true;
            return this;
        }

        public Builder fullTree() {
            condition.fullTree = true;
            return this;
        }

        public Builder most() {
            condition.most = true;
            return this;
        }

        public Builder sameSpot() {
            condition.sameSpot = true;
            return this;
        }

        public Builder position(String... position) {
            condition.position = new ArrayList<>(List.of(position));
            return this;
        }

        public Condition build() {
            return condition;
        }
    }
}
