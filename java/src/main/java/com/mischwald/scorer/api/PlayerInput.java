package com.mischwald.scorer.api;

import java.util.List;

/**
 * A player and the cards detected in their play area.
 */
public record PlayerInput(String name, List<DetectedCard> cards) {

    public PlayerInput {
        cards = cards != null ? List.copyOf(cards) : List.of();
    }
}
