package ai.blackjack.player;

import ai.blackjack.game.Action;
import ai.blackjack.game.BlackjackRules;
import ai.blackjack.game.GameState;
import ai.blackjack.player.ai.StandEvaluator;
import ai.blackjack.player.ai.tree.SearchResult;
import java.util.Objects;

/**
 * Base class for search-based players.
 *
 * <p>Subclasses implement {@link #decide(GameState)}; this class turns the decision into an
 * action for the game loop and keeps the most recent {@link SearchResult} for logging and
 * statistics.
 */
public abstract class AIPlayer implements Player {

    protected final BlackjackRules rules;
    protected final StandEvaluator evaluator;

    private SearchResult lastResult;

    protected AIPlayer(BlackjackRules rules, StandEvaluator evaluator) {
        this.rules = Objects.requireNonNull(rules, "rules");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
    }

    /**
     * Search the given state and return the chosen action with its values.
     *
     * @throws IllegalStateException if it is not the player's turn
     */
    public abstract SearchResult decide(GameState state);

    @Override
    public Action nextAction(GameState state) {
        SearchResult result = decide(state);
        lastResult = result;
        return result.action();
    }

    /**
     * Result of the most recent {@link #nextAction(GameState)} call, or null before the first.
     */
    public SearchResult getLastResult() {
        return lastResult;
    }

    public BlackjackRules getRules() {
        return rules;
    }
}
