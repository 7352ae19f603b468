package ai.blackjack.game;

import java.util.Objects;

/**
 * Immutable rule set shared by the environment, the evaluator and every search agent.
 *
 * <p>Passing the rules explicitly (rather than reading global constants) lets tests
 * run rule variants side by side.
 *
 * @param targetTotal          totals above this bust (21)
 * @param dealerStandThreshold the dealer stands on this total or higher (17)
 * @param aceRule              how Aces are scored
 * @param initialCards         cards dealt to each side at the start of a hand
 */
public record BlackjackRules(int targetTotal, int dealerStandThreshold, AceRule aceRule, int initialCards) {

    public static final int DEFAULT_TARGET_TOTAL = 21;
    public static final int DEFAULT_DEALER_STAND_THRESHOLD = 17;
    public static final int DEFAULT_INITIAL_CARDS = 2;

    private static final BlackjackRules STANDARD = new BlackjackRules(
            DEFAULT_TARGET_TOTAL, DEFAULT_DEALER_STAND_THRESHOLD, AceRule.SOFT, DEFAULT_INITIAL_CARDS);

    public BlackjackRules {
        Objects.requireNonNull(aceRule, "aceRule");
        if (targetTotal < 2) {
            throw new IllegalArgumentException("targetTotal must be at least 2 but was " + targetTotal);
        }
        if (dealerStandThreshold < 2 || dealerStandThreshold > targetTotal) {
            throw new IllegalArgumentException("dealerStandThreshold must be in [2, " + targetTotal
                    + "] but was " + dealerStandThreshold);
        }
        if (initialCards < 1) {
            throw new IllegalArgumentException("initialCards must be positive but was " + initialCards);
        }
    }

    /**
     * The simplified house rules: bust over 21, dealer stands on 17 (soft 17 included),
     * soft Aces, two cards each.
     */
    public static BlackjackRules standard() {
        return STANDARD;
    }

    /**
     * Returns a copy of these rules with a different Ace rule.
     */
    public BlackjackRules withAceRule(AceRule rule) {
        return new BlackjackRules(targetTotal, dealerStandThreshold, rule, initialCards);
    }

    /**
     * Highest dealer total on which the dealer still draws (16 under standard rules).
     */
    public int dealerHitThreshold() {
        return dealerStandThreshold - 1;
    }

    public boolean isBust(int total) {
        return total > targetTotal;
    }
}
