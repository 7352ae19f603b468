package ai.blackjack.results;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ai.blackjack.Game.SessionResult;
import ai.blackjack.game.BlackjackRules;
import ai.blackjack.player.ai.expectimax.ExpectimaxPlayer;
import org.junit.jupiter.api.Test;

/**
 * Plays a seeded sweep with {@link ExpectimaxPlayer} and prints a row for the comparison table.
 * Use -Dtest.hands=N to adjust the number of hands.
 */
public class ExpectimaxPlayerResultsTest {

    @Test
    void playManyHandsAndReport() {
        BlackjackRules rules = BlackjackRules.standard();
        SessionResult result = ResultsTable.sweep(new ExpectimaxPlayer(rules, ResultsConfig.DEPTH), rules);
        ResultsTable.row("Expectimax", "Depth " + ResultsConfig.DEPTH, result,
                "Chance node over the 13 ranks; see [code](engine/src/main/java/ai/blackjack/player/ai/expectimax/ExpectimaxPlayer.java).");
        assertEquals(ResultsConfig.HANDS, result.getHandsPlayed());
        assertEquals(0, result.getAbandoned());
    }
}
