package ai.blackjack.game;

/**
 * Enumeration representing the 13 ranks of a standard playing card deck.
 * <p>
 * Each rank carries the point value it contributes to a Blackjack hand and a
 * short label for display (e.g., "A", "K", "10"). Face cards are worth 10 and
 * the Ace is worth 11 before any soft demotion; see {@link AceRule} for how
 * the Ace is actually scored under a given rule set.
 * <p>
 * Under the infinite-deck model every rank is drawn with the same weight, so
 * ten-valued cards (10, J, Q, K) together make up 4/13 of all draws.
 */
public enum Rank {
    /** Ace - worth 11, or 1 once demoted (see {@link AceRule}). */
    ACE(11, "A"),
    /** Two - worth 2. */
    TWO(2, "2"),
    /** Three - worth 3. */
    THREE(3, "3"),
    /** Four - worth 4. */
    FOUR(4, "4"),
    /** Five - worth 5. */
    FIVE(5, "5"),
    /** Six - worth 6. */
    SIX(6, "6"),
    /** Seven - worth 7. */
    SEVEN(7, "7"),
    /** Eight - worth 8. */
    EIGHT(8, "8"),
    /** Nine - worth 9. */
    NINE(9, "9"),
    /** Ten - worth 10. */
    TEN(10, "10"),
    /** Jack - worth 10. */
    JACK(10, "J"),
    /** Queen - worth 10. */
    QUEEN(10, "Q"),
    /** King - worth 10. */
    KING(10, "K");

    /** Points this rank adds to a hand (Ace at its high value). */
    private final int points;
    /** Short string label for display (e.g., "A", "K", "10"). */
    private final String label;

    Rank(int points, String label) {
        this.points = points;
        this.label = label;
    }

    /**
     * Returns the point value of this rank.
     *
     * @return 2-10 for number and face cards, 11 for the Ace
     */
    public int getPoints() {
        return points;
    }

    /**
     * Returns the short string label of this rank.
     *
     * @return the label (e.g., "A", "K", "10")
     */
    public String getLabel() {
        return label;
    }

    public boolean isAce() {
        return this == ACE;
    }

    /**
     * Looks up a rank by its label, case-insensitively.
     *
     * @param label a label such as "A", "10" or "q"
     * @return the matching rank
     * @throws IllegalArgumentException if no rank has that label
     */
    public static Rank fromLabel(String label) {
        for (Rank rank : values()) {
            if (rank.label.equalsIgnoreCase(label.trim())) {
                return rank;
            }
        }
        throw new IllegalArgumentException("Unknown rank label: " + label);
    }

    @Override
    public String toString() {
        return label;
    }
}
