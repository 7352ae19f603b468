package ai.blackjack.unit.game;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.blackjack.game.AceRule;
import ai.blackjack.game.BlackjackRules;
import ai.blackjack.game.Hand;
import ai.blackjack.game.Rank;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Card values and hand totals under each {@link AceRule}.
 */
class HandTest {
    private static final BlackjackRules SOFT = BlackjackRules.standard();
    private static final BlackjackRules ONE = SOFT.withAceRule(AceRule.ONE);
    private static final BlackjackRules ELEVEN = SOFT.withAceRule(AceRule.ELEVEN);

    // ========================================================================
    // Rank
    // ========================================================================

    @Nested
    @DisplayName("Rank")
    class RankTests {

        @Test
        void faceCardsAreWorthTen() {
            assertEquals(10, Rank.TEN.getPoints());
            assertEquals(10, Rank.JACK.getPoints());
            assertEquals(10, Rank.QUEEN.getPoints());
            assertEquals(10, Rank.KING.getPoints());
        }

        @Test
        void numberCardsAreWorthTheirFaceValue() {
            assertEquals(2, Rank.TWO.getPoints());
            assertEquals(9, Rank.NINE.getPoints());
        }

        @Test
        void aceIsElevenBeforeDemotion() {
            assertEquals(11, Rank.ACE.getPoints());
            assertTrue(Rank.ACE.isAce());
            assertFalse(Rank.KING.isAce());
        }

        @Test
        void thirteenRanks() {
            assertEquals(13, Rank.values().length);
        }

        @Test
        void labelsRoundTripCaseInsensitively() {
            assertEquals(Rank.QUEEN, Rank.fromLabel("q"));
            assertEquals(Rank.TEN, Rank.fromLabel(" 10 "));
            assertEquals(Rank.ACE, Rank.fromLabel("A"));
            assertThrows(IllegalArgumentException.class, () -> Rank.fromLabel("11"));
        }
    }

    // ========================================================================
    // Soft Aces (default rule)
    // ========================================================================

    @Nested
    @DisplayName("soft Aces")
    class SoftAceTests {

        @Test
        void aceSixIsSoftSeventeen() {
            Hand hand = Hand.of(SOFT, Rank.ACE, Rank.SIX);
            assertEquals(17, hand.getTotal());
            assertTrue(hand.isSoft());
        }

        @Test
        void softHandDemotesInsteadOfBusting() {
            Hand hand = Hand.of(SOFT, Rank.ACE, Rank.SIX, Rank.TEN);
            assertEquals(17, hand.getTotal());
            assertFalse(hand.isSoft(), "The Ace must now count as 1");
            assertFalse(hand.isBust(SOFT));
        }

        @Test
        void twoAcesAreSoftTwelve() {
            Hand hand = Hand.of(SOFT, Rank.ACE, Rank.ACE);
            assertEquals(12, hand.getTotal());
            assertEquals(1, hand.getSoftAces());
        }

        @Test
        void twoAcesAndNineAreTwentyOne() {
            Hand hand = Hand.of(SOFT, Rank.ACE, Rank.ACE, Rank.NINE);
            assertEquals(21, hand.getTotal());
            assertTrue(hand.isSoft());
        }

        @Test
        void hardHandBustsOverTwentyOne() {
            Hand hand = Hand.of(SOFT, Rank.TEN, Rank.SIX, Rank.KING);
            assertEquals(26, hand.getTotal());
            assertTrue(hand.isBust(SOFT));
        }

        @Test
        void dealtHandMatchesPreTotalledHandForPlay() {
            assertEquals(Hand.hard(16).key(), Hand.of(SOFT, Rank.TEN, Rank.SIX).key());
            assertEquals(Hand.soft(17).key(), Hand.of(SOFT, Rank.ACE, Rank.SIX).key());
            assertNotEquals(Hand.hard(17).key(), Hand.soft(17).key());
        }
    }

    // ========================================================================
    // Fixed Ace rules
    // ========================================================================

    @Nested
    @DisplayName("fixed Ace rules")
    class FixedAceTests {

        @Test
        void aceAsOneIsNeverSoft() {
            Hand hand = Hand.of(ONE, Rank.ACE, Rank.SIX);
            assertEquals(7, hand.getTotal());
            assertFalse(hand.isSoft());
        }

        @Test
        void aceAsElevenNeverDemotes() {
            Hand hand = Hand.of(ELEVEN, Rank.ACE, Rank.ACE);
            assertEquals(22, hand.getTotal());
            assertFalse(hand.isSoft());
            assertTrue(hand.isBust(ELEVEN));
        }
    }

    // ========================================================================
    // Construction and display
    // ========================================================================

    @Nested
    @DisplayName("construction")
    class ConstructionTests {

        @Test
        void plusDoesNotMutateTheOriginal() {
            Hand before = Hand.of(SOFT, Rank.TEN);
            Hand after = before.plus(Rank.FIVE, SOFT);
            assertEquals(10, before.getTotal());
            assertEquals(15, after.getTotal());
            assertEquals(List.of(Rank.TEN, Rank.FIVE), after.getCards());
        }

        @Test
        void cardsAreUnmodifiable() {
            Hand hand = Hand.of(SOFT, Rank.TEN);
            assertThrows(UnsupportedOperationException.class, () -> hand.getCards().add(Rank.TWO));
        }

        @Test
        void softTotalTooSmallForItsAcesIsRejected() {
            assertThrows(IllegalArgumentException.class, () -> Hand.valued(5, 1));
            assertThrows(IllegalArgumentException.class, () -> Hand.hard(-1));
        }

        @Test
        void toStringShowsCardsAndTotal() {
            assertEquals("[10, 6] = 16", Hand.of(SOFT, Rank.TEN, Rank.SIX).toString());
            assertEquals("[A, 6] = soft 17", Hand.of(SOFT, Rank.ACE, Rank.SIX).toString());
            assertEquals("16", Hand.hard(16).toString());
        }

        @Test
        void nullRankIsRejected() {
            assertThrows(NullPointerException.class, () -> Hand.empty().plus(null, SOFT));
        }
    }
}
