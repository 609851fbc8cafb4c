package com.mischwald.scorer.layout;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * A tree card with the cards played on its four sides.
 */
public class Tree {
    private final CardInstance anchor;
    private final Map<Side, List<CardInstance>> sides = new EnumMap<>(Side.class);

    public Tree(CardInstance anchor) {
        this.anchor = anchor;
        for (Side side : Side.values()) {
            sides.put(side, new ArrayList<>());
        }
    }

    public CardInstance getAnchor() {
        return anchor;
    }

    /**
     * Cards on one side, in the order they were attached.
     */
    public List<CardInstance> side(Side side) {
        return Collections.unmodifiableList(sides.get(side));
    }

    void attach(Side side, CardInstance card) {
        sides.get(side).add(card);
    }

    /**
     * A tree is full when every side holds at least one card.
     */
    public boolean isFull() {
        for (List<CardInstance> cards : sides.values()) {
            if (cards.isEmpty()) {
                return false;
            }
        }
        return true;
    }

    /**
     * All attached cards: top, bottom, left, then right.
     */
    public List<CardInstance> attachments() {
        List<CardInstance> result = new ArrayList<>();
        result.addAll(sides.get(Side.TOP));
        result.addAll(sides.get(Side.BOTTOM));
        result.addAll(sides.get(Side.LEFT));
        result.addAll(sides.get(Side.RIGHT));
        return result;
    }

    /**
     * The anchor followed by top, left, right and bottom cards.
     */
    public List<CardInstance> members() {
        List<CardInstance> result = new ArrayList<>();
        result.add(anchor);
        result.addAll(sides.get(Side.TOP));
        result.addAll(sides.get(Side.LEFT));
        result.addAll(sides.get(Side.RIGHT));
        result.addAll(sides.get(Side.BOTTOM));
        return result;
    }

    public int attachmentCount() {
        int count = 0;
        for (List<CardInstance> cards : sides.values()) {
            count += cards.size();
        }
        return count;
    }
}
