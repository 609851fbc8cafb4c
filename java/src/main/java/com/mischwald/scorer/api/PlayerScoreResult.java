package com.mischwald.scorer.api;

import java.util.List;

/**
 * Total and per-card breakdown for one player.
 */
public record PlayerScoreResult(String name, int totalScore, List<CardScoreDetail> cardDetails) {

    public PlayerScoreResult {
        cardDetails = List.copyOf(cardDetails);
    }

    public static PlayerScoreResult empty(String name) {
        return new PlayerScoreResult(name, 0, List.of());
    }
}
