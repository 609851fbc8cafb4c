package com.mischwald.scorer.card;

/**
 * Score rule variants; the variant itself is chosen by the "type" property of the card file.
 */
public enum RuleType {
    FIXED,
    MULTIPLICATION,
    TABLE
}
