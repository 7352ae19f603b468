package ai.blackjack.game;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable Blackjack hand.
 *
 * <p>A hand tracks the cards it was dealt (for display and logs), its best total under the
 * active {@link AceRule}, and how many Aces are still counted as 11. Two hands with the same
 * total and soft-Ace count are interchangeable for play, which is what {@link #key()} captures.
 *
 * <p>Hands can also be "pre-totalled" with {@link #hard(int)}, carrying a total but no cards.
 * This is how analysis code and tests describe positions such as "player 16 vs dealer 10"
 * without choosing specific cards.
 */
public final class Hand {

    private static final Hand EMPTY = new Hand(List.of(), 0, 0);

    private final List<Rank> cards;
    private final int total;
    private final int softAces;

    private Hand(List<Rank> cards, int total, int softAces) {
        this.cards = cards;
        this.total = total;
        this.softAces = softAces;
    }

    public static Hand empty() {
        return EMPTY;
    }

    /**
     * Builds a hand by dealing the given ranks in order under the given rules.
     */
    public static Hand of(BlackjackRules rules, Rank... ranks) {
        Hand hand = EMPTY;
        for (Rank rank : ranks) {
            hand = hand.plus(rank, rules);
        }
        return hand;
    }

    /**
     * A pre-totalled hand with the given number of Aces still counted as 11.
     */
    public static Hand valued(int total, int softAces) {
        if (total < 0 || softAces < 0 || total < 11 * softAces) {
            throw new IllegalArgumentException("invalid hand value: total=" + total + ", softAces=" + softAces);
        }
        return new Hand(List.of(), total, softAces);
    }

    /**
     * A pre-totalled hand with no soft Aces.
     *
     * @param total the hand total; must not be negative
     */
    public static Hand hard(int total) {
        return valued(total, 0);
    }

    /**
     * A pre-totalled hand holding one Ace still counted as 11 (e.g. {@code soft(17)} is A+6).
     */
    public static Hand soft(int total) {
        return valued(total, 1);
    }

    /**
     * Returns a new hand with one more card. Soft Aces are demoted while the total exceeds
     * the target and a demotable Ace remains.
     */
    public Hand plus(Rank rank, BlackjackRules rules) {
        Objects.requireNonNull(rank, "rank");
        AceRule aceRule = rules.aceRule();
        int newTotal = total + aceRule.pointsFor(rank);
        int newSoftAces = softAces;
        if (rank.isAce() && aceRule.allowsDemotion()) {
            newSoftAces++;
        }
        while (newTotal > rules.targetTotal() && newSoftAces > 0) {
            newTotal -= 10;
            newSoftAces--;
        }
        List<Rank> newCards = new ArrayList<>(cards.size() + 1);
        newCards.addAll(cards);
        newCards.add(rank);
        return new Hand(Collections.unmodifiableList(newCards), newTotal, newSoftAces);
    }

    public List<Rank> getCards() {
        return cards;
    }

    public int getTotal() {
        return total;
    }

    public int getSoftAces() {
        return softAces;
    }

    public boolean isSoft() {
        return softAces > 0;
    }

    public boolean isBust(BlackjackRules rules) {
        return rules.isBust(total);
    }

    /**
     * Play-relevant identity of this hand: the total and the number of soft Aces.
     */
    public Key key() {
        return new Key(total, softAces);
    }

    /**
     * Memo key for hand values.
     */
    public record Key(int total, int softAces) {
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Hand)) {
            return false;
        }
        Hand hand = (Hand) o;
        return total == hand.total && softAces == hand.softAces && cards.equals(hand.cards);
    }

    @Override
    public int hashCode() {
        return Objects.hash(cards, total, softAces);
    }

    @Override
    public String toString() {
        String prefix = isSoft() ? "soft " : "";
        if (cards.isEmpty()) {
            return prefix + total;
        }
        return cards + " = " + prefix + total;
    }
}
