package ai.blackjack.player.ai.expectimax;

import ai.blackjack.config.SearchProperties;
import ai.blackjack.game.BlackjackRules;
import ai.blackjack.player.ai.tree.DeckReducer;
import ai.blackjack.player.ai.tree.ReducingSearch;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Expectimax player.
 *
 * <p>Same player nodes as minimax, but the deck is a chance node: the value of a HIT is the
 * expectation over the 13 ranks, each with weight 1/13 regardless of history (infinite deck).
 * Chance nodes cannot be short-circuited without bounds on the unexplored branches, so all 13
 * branches are always expanded.
 */
@Component
@Profile("ai-expectimax")
public class ExpectimaxPlayer extends ReducingSearch {

    public ExpectimaxPlayer() {
        this(BlackjackRules.standard(), DEFAULT_MAX_DEPTH);
    }

    @Autowired
    public ExpectimaxPlayer(BlackjackRules rules, SearchProperties search) {
        this(rules, search.getDepth());
    }

    public ExpectimaxPlayer(BlackjackRules rules, int maxDepth) {
        super(rules, maxDepth, DeckReducer.EXPECTED);
    }
}
