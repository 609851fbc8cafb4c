package com.mischwald.scorer.scoring;

/**
 * Points awarded to one card and why.
 */
public record ScoreResult(int points, String reason) {

    public static final String NO_EFFECT = "no effect";

    public static ScoreResult noEffect() {
        return new ScoreResult(0, NO_EFFECT);
    }
}
