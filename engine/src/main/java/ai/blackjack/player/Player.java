package ai.blackjack.player;

import ai.blackjack.game.Action;
import ai.blackjack.game.GameState;

/**
 * Represents a player capable of choosing the next action for the game loop.
 */
public interface Player {

    /**
     * Choose the next action for a state on the player's turn.
     *
     * @param state current hand; the player's turn
     * @return HIT or STAND, or null to signal that input closed and the session should end
     */
    Action nextAction(GameState state);
}
