package ai.blackjack.unit.player;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

import ai.blackjack.game.BlackjackRules;
import ai.blackjack.game.Hand;
import ai.blackjack.player.ai.DealerOutcomeTable;
import ai.blackjack.player.ai.DealerOutcomeTable.DealerOutcomes;
import org.junit.jupiter.api.Test;

/**
 * Exact dealer final-total distributions under the infinite deck.
 */
class DealerOutcomeTableTest {
    private static final double EPS = 1e-9;

    private final DealerOutcomeTable table = new DealerOutcomeTable(BlackjackRules.standard());

    @Test
    void dealerShowingTenMatchesKnownDistribution() {
        DealerOutcomes outcomes = table.outcomes(Hand.hard(10));

        assertEquals(0.11142433852261402, outcomes.probabilityOf(17), EPS);
        assertEquals(0.11142433852261402, outcomes.probabilityOf(18), EPS);
        assertEquals(0.11142433852261402, outcomes.probabilityOf(19), EPS);
        assertEquals(0.3421935692918448, outcomes.probabilityOf(20), EPS);
        assertEquals(0.11142433852261402, outcomes.probabilityOf(21), EPS);
        assertEquals(0.21210907661769923, outcomes.bustProbability(), EPS);
    }

    @Test
    void dealerShowingSixBustsMostOften() {
        DealerOutcomes outcomes = table.outcomes(Hand.hard(6));
        assertEquals(0.42315049208499783, outcomes.bustProbability(), EPS);
    }

    @Test
    void everyStartingTotalSumsToOne() {
        for (int total = 2; total <= 26; total++) {
            assertEquals(1.0, table.outcomes(Hand.hard(total)).totalProbability(), EPS, "hard " + total);
        }
        for (int total = 12; total <= 21; total++) {
            assertEquals(1.0, table.outcomes(Hand.soft(total)).totalProbability(), EPS, "soft " + total);
        }
    }

    @Test
    void standingDealerHasASingleResult() {
        DealerOutcomes outcomes = table.outcomes(Hand.soft(17));
        assertEquals(1.0, outcomes.probabilityOf(17));
        assertEquals(0.0, outcomes.bustProbability());
    }

    @Test
    void bustDealerIsCertainBust() {
        assertEquals(1.0, table.outcomes(Hand.hard(24)).bustProbability());
    }

    @Test
    void totalsOutsideTheStandingRangeHaveNoProbability() {
        DealerOutcomes outcomes = table.outcomes(Hand.hard(10));
        assertEquals(0.0, outcomes.probabilityOf(16));
        assertEquals(0.0, outcomes.probabilityOf(22));
    }

    @Test
    void resultsAreMemoisedByHandKey() {
        DealerOutcomes first = table.outcomes(Hand.hard(12));
        int size = table.size();
        DealerOutcomes again = table.outcomes(Hand.hard(12));

        assertSame(first, again);
        assertEquals(size, table.size());
    }

    @Test
    void standValueCountsWinsAndHalfOfPushes() {
        DealerOutcomes outcomes = table.outcomes(Hand.hard(18));
        assertEquals(0.5, outcomes.standValue(18));
        assertEquals(1.0, outcomes.standValue(19));
        assertEquals(0.0, outcomes.standValue(17));
    }
}
