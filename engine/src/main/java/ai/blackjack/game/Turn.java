package ai.blackjack.game;

/**
 * Whose turn it is in a hand.
 */
public enum Turn {
    /** The player may hit or stand. */
    PLAYER,
    /** The player stood; the dealer plays its fixed policy next. */
    DEALER,
    /** The hand is over and has an {@link Outcome}. */
    TERMINAL
}
