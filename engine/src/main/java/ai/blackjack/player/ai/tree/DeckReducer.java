package ai.blackjack.player.ai.tree;

import ai.blackjack.game.CardDraw;

/**
 * How a deck node combines the values of its 13 card branches.
 *
 * <p>This is the only difference between the adversarial and the probabilistic model of the
 * deck; everything else in the tree walk is shared (see {@link ReducingSearch}).
 */
public enum DeckReducer {

    /**
     * Adversarial deck: deals whichever card is worst for the player, ignoring probabilities.
     */
    MIN {
        @Override
        public double identity() {
            return Double.POSITIVE_INFINITY;
        }

        @Override
        public double accumulate(double accumulated, CardDraw draw, double value) {
            return Math.min(accumulated, value);
        }

        @Override
        public double finish(double accumulated, int totalWeight) {
            return accumulated;
        }
    },

    /**
     * Chance node: weighted sum of branch values, divided once by the total weight.
     */
    EXPECTED {
        @Override
        public double identity() {
            return 0.0;
        }

        @Override
        public double accumulate(double accumulated, CardDraw draw, double value) {
            return accumulated + draw.weight() * value;
        }

        @Override
        public double finish(double accumulated, int totalWeight) {
            return accumulated / totalWeight;
        }
    };

    public abstract double identity();

    public abstract double accumulate(double accumulated, CardDraw draw, double value);

    public abstract double finish(double accumulated, int totalWeight);
}
