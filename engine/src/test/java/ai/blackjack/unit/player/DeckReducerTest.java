package ai.blackjack.unit.player;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ai.blackjack.game.CardDraw;
import ai.blackjack.game.InfiniteDeck;
import ai.blackjack.player.ai.tree.DeckReducer;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * How deck nodes fold their 13 branches.
 */
class DeckReducerTest {
    private static final List<CardDraw> DRAWS = InfiniteDeck.distribution();

    private static double reduce(DeckReducer reducer, double[] values) {
        double acc = reducer.identity();
        int totalWeight = 0;
        for (int i = 0; i < DRAWS.size(); i++) {
            acc = reducer.accumulate(acc, DRAWS.get(i), values[i]);
            totalWeight += DRAWS.get(i).weight();
        }
        return reducer.finish(acc, totalWeight);
    }

    @Test
    void expectationOfAConstantIsExactlyThatConstant() {
        double[] values = new double[13];
        Arrays.fill(values, 1.0);
        assertEquals(1.0, reduce(DeckReducer.EXPECTED, values));
    }

    @Test
    void expectationWeighsEachRankEqually() {
        double[] values = new double[13];
        values[0] = 1.0;
        assertEquals(1.0 / 13, reduce(DeckReducer.EXPECTED, values), 1e-15);
    }

    @Test
    void minimumIgnoresProbabilities() {
        double[] values = new double[13];
        Arrays.fill(values, 0.9);
        values[9] = 0.1;
        assertEquals(0.1, reduce(DeckReducer.MIN, values));
    }
}
