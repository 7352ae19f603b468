package ai.blackjack.player.ai.minimax;

import ai.blackjack.config.SearchProperties;
import ai.blackjack.game.BlackjackRules;
import ai.blackjack.game.CardDraw;
import ai.blackjack.game.GameState;
import ai.blackjack.player.ai.tree.GameTreeSearch;
import java.util.List;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Minimax player with alpha-beta pruning.
 *
 * <p>Values are those of {@link MinimaxPlayer}; the bounds only skip work:
 * <ul>
 *     <li>{@code alpha}: the best value the player is already guaranteed on the path to the root.</li>
 *     <li>{@code beta}: the best value the deck is already guaranteed on that path.</li>
 *     <li>At a deck node the rank loop stops once the running minimum is {@code <= alpha}.</li>
 *     <li>At a player node STAND is tried first; HIT is skipped once the value is {@code >= beta}.</li>
 * </ul>
 *
 * <p>The root starts with {@code alpha = value(STAND)}, so a HIT subtree that cannot beat
 * standing is abandoned as soon as one card proves it. The root action and root value always
 * equal the unpruned search's.
 */
@Component
@Profile("ai-alphabeta")
public class AlphaBetaPlayer extends GameTreeSearch {

    public AlphaBetaPlayer() {
        this(BlackjackRules.standard(), DEFAULT_MAX_DEPTH);
    }

    @Autowired
    public AlphaBetaPlayer(BlackjackRules rules, SearchProperties search) {
        this(rules, search.getDepth());
    }

    public AlphaBetaPlayer(BlackjackRules rules, int maxDepth) {
        super(rules, maxDepth);
    }

    @Override
    protected double rootHitValue(GameState state, double standValue, SearchStats stats) {
        return minValue(state, maxDepth - 1, standValue, Double.POSITIVE_INFINITY, stats);
    }

    private double maxValue(GameState state, int depth, double alpha, double beta, SearchStats stats) {
        stats.countNode();
        if (state.isTerminal()) {
            return evaluator.evaluate(state);
        }
        double best = standValue(state);
        if (depth == 0 || best >= beta) {
            return best;
        }
        double hit = minValue(state, depth - 1, Math.max(alpha, best), beta, stats);
        return Math.max(best, hit);
    }

    private double minValue(GameState state, int depth, double alpha, double beta, SearchStats stats) {
        double worst = Double.POSITIVE_INFINITY;
        List<CardDraw> draws = draws();
        for (int i = 0; i < draws.size(); i++) {
            double value = maxValue(deal(state, draws.get(i)), depth, alpha, beta, stats);
            worst = Math.min(worst, value);
            if (worst <= alpha) {
                stats.prune(draws.size() - i - 1);
                break;
            }
            beta = Math.min(beta, worst);
        }
        return worst;
    }
}
