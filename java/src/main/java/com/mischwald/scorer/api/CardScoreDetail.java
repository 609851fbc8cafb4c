package com.mischwald.scorer.api;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Score line of one card.
 *
 * @param cardId the card's label
 * @param title the card's entity id
 * @param group "Structure N" for cards in the N-th tree in reading order, null for unattached cards
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CardScoreDetail(
    String cardId,
    int points,
    String reason,
    String title,
    String group
) {}
