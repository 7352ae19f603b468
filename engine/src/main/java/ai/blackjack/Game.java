package ai.blackjack;

import ai.blackjack.config.GameProperties;
import ai.blackjack.game.Action;
import ai.blackjack.game.BlackjackEnvironment;
import ai.blackjack.game.GameState;
import ai.blackjack.game.Outcome;
import ai.blackjack.game.Turn;
import ai.blackjack.player.AIPlayer;
import ai.blackjack.player.Player;
import ai.blackjack.player.ai.tree.SearchResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class Game implements CommandLineRunner {
    private static final Logger log = LoggerFactory.getLogger(Game.class);
    /** When true, emit structured per-decision episode logs. */
    private static final boolean EPISODE_LOG_ENABLED = EpisodeLogger.isEnabled();

    private final Player player;
    private final BlackjackEnvironment environment;
    private final int hands;

    @Autowired
    public Game(Player player, BlackjackEnvironment environment, GameProperties properties) {
        this(player, environment, properties.getHands());
    }

    public Game(Player player, BlackjackEnvironment environment, int hands) {
        this.player = Objects.requireNonNull(player, "player");
        this.environment = Objects.requireNonNull(environment, "environment");
        if (hands < 1) {
            throw new IllegalArgumentException("hands must be positive but was " + hands);
        }
        this.hands = hands;
    }

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Game.class);
        app.setWebApplicationType(WebApplicationType.NONE);
        app.run(args);
    }

    @Override
    public void run(String... args) {
        SessionResult result = play();
        System.out.println(result);
        log.info("Session finished for {}: {}", player.getClass().getSimpleName(), result);
    }

    /**
     * Plays the configured number of hands, or fewer if the player closes its input.
     *
     * @return win/loss/push tallies, player actions, search effort and elapsed time
     */
    public SessionResult play() {
        List<HandResult> results = new ArrayList<>(hands);
        long startNanos = System.nanoTime();
        for (int handIndex = 0; handIndex < hands; handIndex++) {
            HandResult result = playHand(handIndex);
            results.add(result);
            if (result.isAbandoned()) {
                if (log.isDebugEnabled()) {
                    log.debug("Input closed for player {}; ending session after {} hands",
                            player.getClass().getSimpleName(), handIndex + 1);
                }
                break;
            }
        }
        return new SessionResult(results, System.nanoTime() - startNanos);
    }

    /**
     * Core single-hand loop: deal, ask the player until it stands or busts, then let the
     * dealer play out.
     *
     * <p>A safety cap on player actions ({@code -Dmax.actions.per.hand}, default 32) keeps a
     * misbehaving player from looping forever; a hand stopped by the cap or by closed input is
     * reported with {@link Outcome#UNDECIDED}.
     */
    public HandResult playHand(int handIndex) {
        final int maxActions = Integer.getInteger("max.actions.per.hand", 32);
        boolean aiMode = player instanceof AIPlayer;
        String solverId = player.getClass().getSimpleName();
        long startNanos = System.nanoTime();
        GameState state = environment.initialState();
        int actions = 0;
        int hits = 0;
        long nodesExpanded = 0;

        while (state.getTurn() == Turn.PLAYER) {
            if (actions >= maxActions) {
                if (log.isDebugEnabled()) {
                    log.debug("Maximum action limit reached ({}); abandoning hand {} for {}",
                            maxActions, handIndex, solverId);
                }
                break;
            }
            Action action = player.nextAction(state);
            if (action == null) {
                break;
            }
            SearchResult search = aiMode ? ((AIPlayer) player).getLastResult() : null;
            if (search != null) {
                nodesExpanded += search.nodesExpanded();
            }
            if (EPISODE_LOG_ENABLED) {
                EpisodeLogger.logStep(state, solverId, handIndex, actions,
                        environment.legalActions(state), action, search);
            }
            if (log.isDebugEnabled()) {
                log.debug("Hand {} step {}: {} chose {}", handIndex, actions, state, action);
            }
            actions++;
            if (action == Action.HIT) {
                hits++;
            }
            state = environment.play(state, action);
        }

        HandResult result = new HandResult(state, hits, nodesExpanded, System.nanoTime() - startNanos);
        if (!aiMode) {
            System.out.println(state);
        } else if (log.isDebugEnabled()) {
            log.debug("Hand {} finished: {}", handIndex, state);
        }
        if (EPISODE_LOG_ENABLED) {
            EpisodeLogger.logSummary(solverId, handIndex, result);
        }
        return result;
    }

    /**
     * Result of one hand.
     */
    public static final class HandResult {
        private final GameState finalState;
        private final int hits;
        private final long nodesExpanded;
        private final long durationNanos;

        public HandResult(GameState finalState, int hits, long nodesExpanded, long durationNanos) {
            this.finalState = finalState;
            this.hits = hits;
            this.nodesExpanded = nodesExpanded;
            this.durationNanos = durationNanos;
        }

        public GameState getFinalState() {
            return finalState;
        }

        public Outcome getOutcome() {
            return finalState.getOutcome();
        }

        /**
         * True when the hand stopped before reaching a terminal state.
         */
        public boolean isAbandoned() {
            return !finalState.isTerminal();
        }

        public int getHits() {
            return hits;
        }

        public long getNodesExpanded() {
            return nodesExpanded;
        }

        public long getDurationNanos() {
            return durationNanos;
        }
    }

    /**
     * Tallies over a session of hands.
     */
    public static final class SessionResult {
        private final List<HandResult> hands;
        private final long durationNanos;
        private int wins;
        private int losses;
        private int pushes;
        private int abandoned;
        private int hits;
        private long nodesExpanded;

        public SessionResult(List<HandResult> hands, long durationNanos) {
            this.hands = List.copyOf(hands);
            this.durationNanos = durationNanos;
            for (HandResult hand : hands) {
                switch (hand.getOutcome()) {
                    case WIN -> wins++;
                    case LOSE -> losses++;
                    case PUSH -> pushes++;
                    case UNDECIDED -> abandoned++;
                }
                hits += hand.getHits();
                nodesExpanded += hand.getNodesExpanded();
            }
        }

        public List<HandResult> getHands() {
            return hands;
        }

        public int getHandsPlayed() {
            return hands.size();
        }

        public int getWins() {
            return wins;
        }

        public int getLosses() {
            return losses;
        }

        public int getPushes() {
            return pushes;
        }

        public int getAbandoned() {
            return abandoned;
        }

        public int getHits() {
            return hits;
        }

        public long getNodesExpanded() {
            return nodesExpanded;
        }

        public long getDurationNanos() {
            return durationNanos;
        }

        public double winPercent() {
            return hands.isEmpty() ? 0.0 : wins * 100.0 / hands.size();
        }

        @Override
        public String toString() {
            return String.format("hands=%d wins=%d (%.2f%%) losses=%d pushes=%d abandoned=%d hits=%d nodes=%d time=%.3fs",
                    hands.size(), wins, winPercent(), losses, pushes, abandoned, hits, nodesExpanded,
                    durationNanos / 1_000_000_000.0);
        }
    }
}
