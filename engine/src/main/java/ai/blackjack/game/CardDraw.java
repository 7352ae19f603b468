package ai.blackjack.game;

import java.util.Objects;

/**
 * One branch of a draw: a rank together with its integer weight out of the total weight.
 *
 * <p>Keeping the weights as integers lets the expectation be computed as a weighted sum
 * divided once by {@code totalWeight}.
 */
public record CardDraw(Rank rank, int weight, int totalWeight) {

    public CardDraw {
        Objects.requireNonNull(rank, "rank");
        if (weight <= 0 || totalWeight < weight) {
            throw new IllegalArgumentException("weight " + weight + " out of " + totalWeight);
        }
    }

    public double probability() {
        return (double) weight / totalWeight;
    }
}
