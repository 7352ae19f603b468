package ai.blackjack.game;

/**
 * Supplies the next card dealt by the environment.
 */
@FunctionalInterface
public interface CardSource {

    /**
     * Draws the next card. Never returns null.
     */
    Rank draw();
}
