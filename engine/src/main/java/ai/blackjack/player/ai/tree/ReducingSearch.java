package ai.blackjack.player.ai.tree;

import ai.blackjack.game.BlackjackRules;
import ai.blackjack.game.CardDraw;
import ai.blackjack.game.GameState;
import ai.blackjack.game.Rank;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Exhaustive tree walk whose deck nodes are combined by a {@link DeckReducer}.
 *
 * <p>With {@link DeckReducer#MIN} this is plain minimax (the deck as an adversary); with
 * {@link DeckReducer#EXPECTED} it is expectimax (the deck as a chance node). Every branch of every
 * deck node is expanded; there is no pruning.
 */
public abstract class ReducingSearch extends GameTreeSearch {

    private final DeckReducer reducer;

    protected ReducingSearch(BlackjackRules rules, int maxDepth, DeckReducer reducer) {
        super(rules, maxDepth);
        this.reducer = Objects.requireNonNull(reducer, "reducer");
    }

    public DeckReducer getReducer() {
        return reducer;
    }

    @Override
    protected double rootHitValue(GameState state, double standValue, SearchStats stats) {
        return deckValue(state, maxDepth - 1, stats);
    }

    /**
     * Value of each card branch below a HIT at the root, in rank order. Reducing these with the
     * search's {@link DeckReducer} gives the root's hit value.
     */
    public Map<Rank, Double> hitBranchValues(GameState state) {
        requirePlayerTurn(state);
        SearchStats stats = new SearchStats();
        Map<Rank, Double> values = new EnumMap<>(Rank.class);
        for (CardDraw draw : draws()) {
            values.put(draw.rank(), maxValue(deal(state, draw), maxDepth - 1, stats));
        }
        return Collections.unmodifiableMap(values);
    }

    private double maxValue(GameState state, int depth, SearchStats stats) {
        stats.countNode();
        if (state.isTerminal()) {
            return evaluator.evaluate(state);
        }
        double stand = standValue(state);
        if (depth == 0) {
            return stand;
        }
        return Math.max(stand, deckValue(state, depth - 1, stats));
    }

    private double deckValue(GameState state, int depth, SearchStats stats) {
        double accumulated = reducer.identity();
        int totalWeight = 0;
        for (CardDraw draw : draws()) {
            double value = maxValue(deal(state, draw), depth, stats);
            accumulated = reducer.accumulate(accumulated, draw, value);
            totalWeight += draw.weight();
        }
        return reducer.finish(accumulated, totalWeight);
    }
}
