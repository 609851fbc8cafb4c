package com.mischwald.scorer.card;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * Score rule of a card definition - a sealed interface with one variant per rule type.
 * Uses Jackson polymorphic deserialization based on the "type" field, so the
 * shape of "amount" (scalar or table) is fixed when the card file is loaded.
 */
@JsonTypeInfo(
    use = JsonTypeInfo.Id.NAME,
    include = JsonTypeInfo.As.PROPERTY,
    property = "type"
)
@JsonSubTypes({
    @JsonSubTypes.Type(value = ScoreRule.Fixed.class, name = "fixed"),
    @JsonSubTypes.Type(value = ScoreRule.Multiplication.class, name = "multiplication"),
    @JsonSubTypes.Type(value = ScoreRule.Table.class, name = "table")
})
public sealed interface ScoreRule permits ScoreRule.Fixed, ScoreRule.Multiplication, ScoreRule.Table {

    RuleType getRuleType();
    Integer getMin();
    Condition getCondition();
    boolean hasCondition();

    /**
     * A fixed amount, optionally gated by a condition reaching {@code min}.
     */
    final class Fixed extends BaseScoreRule implements ScoreRule {
        @JsonProperty("amount")
        private int amount;

        public Fixed() {
        }

        public Fixed(int amount, Integer min, Condition condition) {
            super(min, condition);
            this.amount = amount;
        }

        public int getAmount() {
            return amount;
        }

        @Override
        public RuleType getRuleType() {
            return RuleType.FIXED;
        }
    }

    /**
     * Amount per matching card.
     */
    final class Multiplication extends BaseScoreRule implements ScoreRule {
        @JsonProperty("amount")
        private int amount;

        public Multiplication() {
        }

        public Multiplication(int amount, Integer min, Condition condition) {
            super(min, condition);
            this.amount = amount;
        }

        public int getAmount() {
            return amount;
        }

        @Override
        public RuleType getRuleType() {
            return RuleType.MULTIPLICATION;
        }
    }

    /**
     * Points looked up by match count; the last entry covers every larger count.
     */
    final class Table extends BaseScoreRule implements ScoreRule {
        @JsonProperty("amount")
        private List<Integer> amounts = List.of();

        public Table() {
        }

        public Table(List<Integer> amounts, Integer min, Condition condition) {
            super(min, condition);
            this.amounts = List.copyOf(amounts);
        }

        public List<Integer> getAmounts() {
            return amounts;
        }

        /**
         * Points for a match count, clamping the index into the table.
         */
        public int pointsFor(int matchCount) {
            if (amounts.isEmpty()) {
                return 0;
            }
            int index = Math.max(0, Math.min(amounts.size() - 1, matchCount - 1));
            return amounts.get(index);
        }

        @Override
        public RuleType getRuleType() {
            return RuleType.TABLE;
        }
    }
}
