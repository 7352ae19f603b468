package ai.blackjack.player.ai.minimax;

import ai.blackjack.config.SearchProperties;
import ai.blackjack.game.BlackjackRules;
import ai.blackjack.game.GameState;
import ai.blackjack.game.Rank;
import ai.blackjack.player.ai.tree.DeckReducer;
import ai.blackjack.player.ai.tree.ReducingSearch;
import java.util.Map;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Minimax player without pruning.
 *
 * <p>Treats the deck as an adversary: after a HIT the deck deals whichever of the 13 ranks is
 * worst for the player, regardless of the fact that each rank only has probability 1/13. The
 * result is a very conservative player. Against any dealer it stands whenever some card can
 * leave it no better off than standing, which in practice means it almost always stands.
 *
 * <p>Kept alongside {@link AlphaBetaPlayer} as the reference for its values and node counts.
 */
@Component
@Profile("ai-minimax")
public class MinimaxPlayer extends ReducingSearch {

    public MinimaxPlayer() {
        this(BlackjackRules.standard(), DEFAULT_MAX_DEPTH);
    }

    @Autowired
    public MinimaxPlayer(BlackjackRules rules, SearchProperties search) {
        this(rules, search.getDepth());
    }

    public MinimaxPlayer(BlackjackRules rules, int maxDepth) {
        super(rules, maxDepth, DeckReducer.MIN);
    }

    /**
     * The card the adversarial deck would deal after a HIT from this state: the first rank, in
     * rank order, whose branch has the minimum value.
     */
    public Rank worstDraw(GameState state) {
        Rank worst = null;
        double worstValue = Double.POSITIVE_INFINITY;
        for (Map.Entry<Rank, Double> branch : hitBranchValues(state).entrySet()) {
            if (branch.getValue() < worstValue) {
                worst = branch.getKey();
                worstValue = branch.getValue();
            }
        }
        return worst;
    }
}
