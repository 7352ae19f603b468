package ai.blackjack.unit.player;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.blackjack.game.BlackjackRules;
import ai.blackjack.game.GameState;
import ai.blackjack.game.Hand;
import ai.blackjack.game.Outcome;
import ai.blackjack.game.Turn;
import ai.blackjack.player.ai.StandEvaluator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Leaf values on the [0, 1] scale: WIN 1, PUSH 0.5, LOSE 0, and the exact value of standing
 * for states still in play.
 */
class StandEvaluatorTest {
    private static final double EPS = 1e-9;

    private final StandEvaluator evaluator = new StandEvaluator(BlackjackRules.standard());

    @Nested
    @DisplayName("terminal states")
    class TerminalTests {

        @Test
        void outcomesMapToTheirValues() {
            assertEquals(1.0, evaluator.evaluate(terminal(Outcome.WIN)));
            assertEquals(0.5, evaluator.evaluate(terminal(Outcome.PUSH)));
            assertEquals(0.0, evaluator.evaluate(terminal(Outcome.LOSE)));
        }

        private GameState terminal(Outcome outcome) {
            return new GameState(Hand.hard(18), Hand.hard(18), Turn.TERMINAL, outcome);
        }
    }

    @Nested
    @DisplayName("states in play")
    class InPlayTests {

        @Test
        void bustPlayerIsWorthNothing() {
            GameState state = new GameState(Hand.hard(23), Hand.hard(10), Turn.DEALER, Outcome.UNDECIDED);
            assertEquals(0.0, evaluator.evaluate(state));
        }

        @Test
        void twentyAgainstSixIsStrong() {
            assertEquals(0.8519792850856724, evaluator.evaluate(GameState.of(20, 6)), EPS);
        }

        @Test
        void sixteenAgainstTenOnlyWinsOnDealerBust() {
            assertEquals(0.21210907661769923, evaluator.evaluate(GameState.of(16, 10)), EPS);
        }

        @Test
        void standingDealerIsScoredDirectly() {
            assertEquals(1.0, evaluator.evaluate(GameState.of(19, 18)));
            assertEquals(0.0, evaluator.evaluate(GameState.of(11, 17)));
        }

        @Test
        void valueNeverDecreasesWithPlayerTotal() {
            for (int dealer = 2; dealer <= 21; dealer++) {
                double previous = -1.0;
                for (int player = 4; player <= 21; player++) {
                    double value = evaluator.evaluate(GameState.of(player, dealer));
                    assertTrue(value >= previous, "player " + player + " vs dealer " + dealer);
                    assertTrue(value >= 0.0 && value <= 1.0);
                    previous = value;
                }
            }
        }
    }
}
