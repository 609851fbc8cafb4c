package com.mischwald.scorer.scoring;

import com.mischwald.scorer.card.Condition;
import com.mischwald.scorer.card.ScoreRule;
import com.mischwald.scorer.layout.CardInstance;

import java.util.ArrayList;
import java.util.List;

import static com.mischwald.scorer.scoring.ScoreReasons.*;

/**
 * Turns a card's score rule and its match count into points and an explanation.
 */
public class ScoreEngine {

    /**
     * Score one instance of the player evaluated by {@code evaluator}.
     */
    public ScoreResult score(CardInstance instance, ConditionEvaluator evaluator) {
        ScoreRule rule = instance.getScoreRule();
        if (rule == null) {
            return ScoreResult.noEffect();
        }
        if (rule instanceof ScoreRule.Fixed fixed) {
            return scoreFixed(instance, fixed, evaluator);
        }
        if (rule instanceof ScoreRule.Multiplication multiplication) {
            return scoreMultiplication(instance, multiplication, evaluator);
        }
        if (rule instanceof ScoreRule.Table table) {
            return scoreTable(instance, table, evaluator);
        }
        return ScoreResult.noEffect();
    }

    private ScoreResult scoreFixed(CardInstance instance, ScoreRule.Fixed rule, ConditionEvaluator evaluator) {
        int amount = rule.getAmount();
        Condition condition = rule.getCondition();
        if (condition == null) {
            return new ScoreResult(amount, amount + " fixed " + pointsWord(amount));
        }

        int matches = evaluator.countMatches(instance, condition);
        int min = rule.getMin() != null ? rule.getMin() : 1;
        String details = matches + " " + matchesWord(matches) + ", at least " + min + " " + target(condition)
                + scopeSuffix(condition) + extrasSuffix(condition);
        if (matches >= min) {
            return new ScoreResult(amount, amount + " fixed " + pointsWord(amount) + " (" + details + ")");
        }
        return new ScoreResult(0, "0 " + pointsWord(0) + " (condition not met: " + details + ")");
    }

    private ScoreResult scoreMultiplication(CardInstance instance, ScoreRule.Multiplication rule,
                                            ConditionEvaluator evaluator) {
        int amount = rule.getAmount();
        Condition condition = rule.getCondition();
        if (condition == null) {
            return new ScoreResult(0, NO_CONDITION);
        }

        int matches = evaluator.countMatches(instance, condition);
        Integer min = rule.getMin();
        int effective = min != null && matches < min ? 0 : matches;
        int points = amount * effective;

        List<String> details = new ArrayList<>();
        if (min != null) {
            details.add("at least " + min);
        }
        if (!scope(condition).isEmpty()) {
            details.add(scope(condition));
        }
        String detailsText = details.isEmpty() ? "" : " (" + String.join(", ", details) + ")";
        String reason = amount + " " + pointsWord(amount) + " per " + target(condition) + " · " + effective
                + detailsText + extrasSuffix(condition);
        return new ScoreResult(points, reason);
    }

    private ScoreResult scoreTable(CardInstance instance, ScoreRule.Table rule, ConditionEvaluator evaluator) {
        Condition condition = rule.getCondition();
        if (condition == null) {
            return new ScoreResult(0, NO_CONDITION);
        }

        int matches = evaluator.countMatches(instance, condition);
        int points = rule.pointsFor(matches);
        String reason = "Table: " + matches + " " + matchesWord(matches) + " (" + target(condition)
                + scopeSuffix(condition) + extrasSuffix(condition) + ")";
        return new ScoreResult(points, reason);
    }
}
