package ai.blackjack.game;

/**
 * How an Ace is scored when it is added to a {@link Hand}.
 */
public enum AceRule {
    /**
     * An Ace counts 11 and is demoted to 1, one Ace at a time, whenever the hand
     * would otherwise exceed the target total. A hand with an Ace still counted
     * as 11 is "soft".
     */
    SOFT,

    /** Every Ace is a fixed 1. Hands are never soft. */
    ONE,

    /** Every Ace is a fixed 11. Hands are never soft, and two Aces bust. */
    ELEVEN;

    /**
     * Points a card of the given rank adds before any soft demotion.
     */
    public int pointsFor(Rank rank) {
        if (rank.isAce() && this == ONE) {
            return 1;
        }
        return rank.getPoints();
    }

    /**
     * Whether an Ace added under this rule may later be demoted from 11 to 1.
     */
    public boolean allowsDemotion() {
        return this == SOFT;
    }
}
