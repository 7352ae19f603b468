package ai.blackjack.game;

/**
 * Result of a hand from the player's point of view.
 */
public enum Outcome {
    WIN(1.0),
    LOSE(0.0),
    PUSH(0.5),
    /** The hand is still in progress. */
    UNDECIDED(Double.NaN);

    private final double value;

    Outcome(double value) {
        this.value = value;
    }

    /**
     * Value of a decided outcome on the evaluator's [0, 1] scale.
     *
     * @throws IllegalStateException for {@link #UNDECIDED}
     */
    public double value() {
        if (this == UNDECIDED) {
            throw new IllegalStateException("An undecided hand has no value");
        }
        return value;
    }

    public boolean isDecided() {
        return this != UNDECIDED;
    }
}
