package ai.blackjack.game;

import java.util.Objects;

/**
 * Immutable snapshot of a hand in progress.
 *
 * <p>Every environment transition returns a new instance, so search branches never share or
 * mutate each other's state.
 *
 * <p>Invariant: {@code outcome} is {@link Outcome#UNDECIDED} exactly when {@code turn} is not
 * {@link Turn#TERMINAL}.
 */
public final class GameState {
    private final Hand player;
    private final Hand dealer;
    private final Turn turn;
    private final Outcome outcome;

    public GameState(Hand player, Hand dealer, Turn turn, Outcome outcome) {
        this.player = Objects.requireNonNull(player, "player");
        this.dealer = Objects.requireNonNull(dealer, "dealer");
        this.turn = Objects.requireNonNull(turn, "turn");
        this.outcome = Objects.requireNonNull(outcome, "outcome");
        boolean terminal = turn == Turn.TERMINAL;
        if (terminal == (outcome == Outcome.UNDECIDED)) {
            throw new IllegalArgumentException(
                    "outcome must be UNDECIDED iff turn is not TERMINAL (turn=" + turn + ", outcome=" + outcome + ")");
        }
    }

    /**
     * A state on the player's turn.
     */
    public static GameState playerTurn(Hand player, Hand dealer) {
        return new GameState(player, dealer, Turn.PLAYER, Outcome.UNDECIDED);
    }

    /**
     * A player-turn state built from pre-totalled hard hands, e.g. {@code of(16, 10)}.
     */
    public static GameState of(int playerTotal, int dealerTotal) {
        return playerTurn(Hand.hard(playerTotal), Hand.hard(dealerTotal));
    }

    public Hand getPlayer() {
        return player;
    }

    public Hand getDealer() {
        return dealer;
    }

    public int playerTotal() {
        return player.getTotal();
    }

    public int dealerTotal() {
        return dealer.getTotal();
    }

    public Turn getTurn() {
        return turn;
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public boolean isTerminal() {
        return turn == Turn.TERMINAL;
    }

    GameState withPlayer(Hand newPlayer) {
        return new GameState(newPlayer, dealer, turn, outcome);
    }

    GameState withDealer(Hand newDealer) {
        return new GameState(player, newDealer, turn, outcome);
    }

    GameState withTurn(Turn newTurn) {
        return new GameState(player, dealer, newTurn, outcome);
    }

    GameState finish(Outcome result) {
        return new GameState(player, dealer, Turn.TERMINAL, result);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GameState)) {
            return false;
        }
        GameState that = (GameState) o;
        return player.equals(that.player) && dealer.equals(that.dealer)
                && turn == that.turn && outcome == that.outcome;
    }

    @Override
    public int hashCode() {
        return Objects.hash(player, dealer, turn, outcome);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("PLAYER ").append(player).append(" | DEALER ").append(dealer).append(" | ").append(turn);
        if (outcome.isDecided()) {
            sb.append(' ').append(outcome);
        }
        return sb.toString();
    }
}
