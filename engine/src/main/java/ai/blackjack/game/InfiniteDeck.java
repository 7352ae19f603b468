package ai.blackjack.game;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Infinite-deck card source: every draw is independent and uniform over the 13 ranks.
 *
 * <p>There is no depletion, so the draw distribution never depends on what was dealt before.
 */
public class InfiniteDeck implements CardSource {

    private static final List<Rank> RANKS = Collections.unmodifiableList(Arrays.asList(Rank.values()));
    private static final List<CardDraw> DISTRIBUTION = buildDistribution();

    private final Random random;

    public InfiniteDeck() {
        this(new Random());
    }

    public InfiniteDeck(long seed) {
        this(new Random(seed));
    }

    public InfiniteDeck(Random random) {
        this.random = random;
    }

    @Override
    public Rank draw() {
        return RANKS.get(random.nextInt(RANKS.size()));
    }

    /**
     * The 13 ranks, each with weight 1 out of 13, in rank order.
     */
    public static List<CardDraw> distribution() {
        return DISTRIBUTION;
    }

    private static List<CardDraw> buildDistribution() {
        CardDraw[] draws = new CardDraw[RANKS.size()];
        for (int i = 0; i < draws.length; i++) {
            draws[i] = new CardDraw(RANKS.get(i), 1, RANKS.size());
        }
        return List.of(draws);
    }

    @Override
    public String toString() {
        return "InfiniteDeck(ranks=" + RANKS.size() + ")";
    }
}
