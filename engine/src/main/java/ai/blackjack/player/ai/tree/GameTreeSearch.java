package ai.blackjack.player.ai.tree;

import ai.blackjack.game.Action;
import ai.blackjack.game.BlackjackEnvironment;
import ai.blackjack.game.BlackjackRules;
import ai.blackjack.game.CardDraw;
import ai.blackjack.game.CardSource;
import ai.blackjack.game.GameState;
import ai.blackjack.game.Turn;
import ai.blackjack.player.AIPlayer;
import ai.blackjack.player.ai.StandEvaluator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for the depth-limited game-tree searches over hit/stand decisions.
 *
 * <p><b>Tree shape:</b>
 * <ul>
 *     <li>Player (MAX) nodes choose between STAND and HIT. STAND has a single deterministic
 *     successor, the dealer playing out its fixed policy, scored exactly by the
 *     {@link StandEvaluator}. HIT leads to a deck node.</li>
 *     <li>Deck nodes branch over the 13 ranks of {@link BlackjackEnvironment#drawDistribution()}.
 *     Subclasses decide how the branches are combined.</li>
 *     <li>A busted player is terminal and scores 0.0. A player node at depth 0 is a cutoff and
 *     scores the value of standing.</li>
 * </ul>
 *
 * <p><b>Depth:</b> the root spends one level on HIT, so {@code maxDepth} bounds the number of
 * extra cards the search considers. Each deck node passes its depth to the player nodes below it.
 *
 * <p><b>Root decision:</b> STAND when {@code value(STAND) >= value(HIT)}, otherwise HIT.
 */
public abstract class GameTreeSearch extends AIPlayer {

    private static final Logger log = LoggerFactory.getLogger(GameTreeSearch.class);

    /** Depth used when none is configured. */
    public static final int DEFAULT_MAX_DEPTH = 4;

    // Search enumerates every draw explicitly; sampling would be a bug.
    private static final CardSource NO_SAMPLING = () -> {
        throw new IllegalStateException("Search must enumerate draws, not sample them");
    };

    protected final BlackjackEnvironment environment;
    protected final int maxDepth;

    protected GameTreeSearch(BlackjackRules rules, int maxDepth) {
        super(rules, new StandEvaluator(rules));
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be at least 1 but was " + maxDepth);
        }
        this.environment = new BlackjackEnvironment(rules, NO_SAMPLING);
        this.maxDepth = maxDepth;
    }

    @Override
    public final SearchResult decide(GameState state) {
        requirePlayerTurn(state);
        SearchStats stats = new SearchStats();
        stats.countNode();
        double stand = standValue(state);
        double hit = rootHitValue(state, stand, stats);
        Action action = stand >= hit ? Action.STAND : Action.HIT;
        SearchResult result = new SearchResult(action, stand, hit, stats.nodes, stats.pruned);
        if (log.isDebugEnabled()) {
            log.debug("{} at depth {}: {} -> {} (stand={}, hit={}, nodes={}, pruned={})",
                    getClass().getSimpleName(), maxDepth, state, action,
                    String.format("%.4f", stand), String.format("%.4f", hit), stats.nodes, stats.pruned);
        }
        return result;
    }

    /**
     * Value of HIT at the root.
     *
     * @param standValue value of STAND at the root, already known to the caller
     */
    protected abstract double rootHitValue(GameState state, double standValue, SearchStats stats);

    /**
     * Exact value of standing in a player-turn state.
     */
    protected double standValue(GameState state) {
        return evaluator.evaluate(environment.applyPlayerAction(state, Action.STAND));
    }

    protected List<CardDraw> draws() {
        return environment.drawDistribution();
    }

    protected GameState deal(GameState state, CardDraw draw) {
        return environment.dealToPlayer(state, draw.rank());
    }

    protected static void requirePlayerTurn(GameState state) {
        if (state.getTurn() != Turn.PLAYER) {
            throw new IllegalStateException("Cannot search from a " + state.getTurn() + " state: " + state);
        }
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    /**
     * Per-decision counters, threaded through the recursion so players stay free of search state.
     */
    protected static final class SearchStats {
        private long nodes;
        private long pruned;

        public void countNode() {
            nodes++;
        }

        public void prune(long branches) {
            pruned += branches;
        }
    }
}
