package ai.blackjack.game;

/**
 * Player actions. Both are legal only on the player's turn.
 */
public enum Action {
    HIT,
    STAND;

    /**
     * Parses a console command such as "hit", "h", "stand" or "s".
     *
     * @return the action, or null if the text is not a recognised command
     */
    public static Action parse(String command) {
        if (command == null) {
            return null;
        }
        switch (command.trim().toLowerCase()) {
            case "hit":
            case "h":
                return HIT;
            case "stand":
            case "s":
                return STAND;
            default:
                return null;
        }
    }
}
