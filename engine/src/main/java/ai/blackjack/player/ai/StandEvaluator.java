package ai.blackjack.player.ai;

import ai.blackjack.game.BlackjackRules;
import ai.blackjack.game.GameState;
import java.util.Objects;

/**
 * Leaf evaluation shared by every search agent.
 *
 * <p>Scores a state on a [0, 1] scale where a win is 1.0, a loss 0.0 and a push 0.5:
 * <ul>
 *     <li>terminal states score their exact outcome,</li>
 *     <li>a busted player scores 0.0,</li>
 *     <li>any other state scores the exact value of standing now, using the dealer's outcome
 *     distribution from {@link DealerOutcomeTable}.</li>
 * </ul>
 * For a fixed dealer hand the score never decreases as the player's non-bust total rises.
 */
public class StandEvaluator {

    private final BlackjackRules rules;
    private final DealerOutcomeTable dealerOutcomes;

    public StandEvaluator(BlackjackRules rules) {
        this(rules, new DealerOutcomeTable(rules));
    }

    public StandEvaluator(BlackjackRules rules, DealerOutcomeTable dealerOutcomes) {
        this.rules = Objects.requireNonNull(rules, "rules");
        this.dealerOutcomes = Objects.requireNonNull(dealerOutcomes, "dealerOutcomes");
    }

    public double evaluate(GameState state) {
        if (state.isTerminal()) {
            return state.getOutcome().value();
        }
        if (rules.isBust(state.playerTotal())) {
            return 0.0;
        }
        return dealerOutcomes.outcomes(state.getDealer()).standValue(state.playerTotal());
    }

    public DealerOutcomeTable getDealerOutcomes() {
        return dealerOutcomes;
    }
}
