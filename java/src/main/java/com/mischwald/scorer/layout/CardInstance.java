package com.mischwald.scorer.layout;

import com.mischwald.scorer.card.CardDefinition;
import com.mischwald.scorer.card.ScoreRule;
import com.mischwald.scorer.geometry.Box;

/**
 * One detected card of a player's layout.
 * The index addresses the instance in its forest and stays stable from build to output.
 */
public final class CardInstance {
    private final int index;
    private final Box box;
    private final String entityId;
    private final String treeSymbol;
    private final CardDefinition definition;

    public CardInstance(int index, Box box, String entityId, String treeSymbol, CardDefinition definition) {
        this.index = index;
        this.box = box;
        this.entityId = entityId;
        this.treeSymbol = treeSymbol;
        this.definition = definition;
    }

    public int getIndex() {
        return index;
    }

    public Box getBox() {
        return box;
    }

    public String getEntityId() {
        return entityId;
    }

    /**
     * Tree symbol printed on the card half that was played, e.g. "oak" for "wolf:oak".
     */
    public String getTreeSymbol() {
        return treeSymbol;
    }

    /**
     * Definition of this card, or null when the id is not in the card database.
     */
    public CardDefinition getDefinition() {
        return definition;
    }

    public boolean hasDefinition() {
        return definition != null;
    }

    /**
     * Score rule of the definition, or null if there is none.
     */
    public ScoreRule getScoreRule() {
        return definition != null ? definition.getScore() : null;
    }

    public boolean isJoker() {
        return definition != null && definition.isJoker();
    }

    public String getLabel() {
        return box.label();
    }

    @Override
    public String toString() {
        return "CardInstance[" + index + ", " + box.label() + "]";
    }
}
