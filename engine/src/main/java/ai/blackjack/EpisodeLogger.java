package ai.blackjack;

import ai.blackjack.game.Action;
import ai.blackjack.game.GameState;
import ai.blackjack.game.Hand;
import ai.blackjack.game.Rank;
import ai.blackjack.player.ai.tree.SearchResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Responsible for emitting structured JSON logs for each decision and each finished hand.
 *
 * <p>Lines go through the {@code ai.blackjack.EpisodeLogger} logger, which logback-spring.xml
 * routes to a separate file (episode.log) for easy filtering and processing.</p>
 */
public class EpisodeLogger {
    private static final Logger log = LoggerFactory.getLogger(EpisodeLogger.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final boolean ENABLED = Boolean.getBoolean("log.episodes");

    private EpisodeLogger() {
    }

    /**
     * Return true if episode logging is enabled via -Dlog.episodes=true.
     */
    public static boolean isEnabled() {
        return ENABLED;
    }

    /**
     * Emit a single JSON line describing the state BEFORE a decision, the legal actions and the
     * chosen action. Search agents also report their stand/hit values and nodes expanded.
     *
     * <p>The line is prefixed with "EPISODE_STEP " so downstream tools can filter it out of
     * mixed logs easily.
     */
    public static void logStep(
            GameState state,
            String solverId,
            int handIndex,
            int stepIndex,
            Set<Action> legalActions,
            Action chosen,
            SearchResult search) {
        try {
            String json = OBJECT_MAPPER.writeValueAsString(stepRecord(
                    state, solverId, handIndex, stepIndex, legalActions, chosen, search));
            if (log.isInfoEnabled()) {
                log.info("EPISODE_STEP {}", json);
            }
        } catch (Exception e) {
            // Logging must never break the game loop.
            if (log.isDebugEnabled()) {
                log.debug("Failed to log episode step", e);
            }
        }
    }

    /**
     * Emit a single JSON line summarising a finished (or abandoned) hand, prefixed with
     * "EPISODE_SUMMARY ".
     */
    public static void logSummary(String solverId, int handIndex, Game.HandResult result) {
        try {
            String json = OBJECT_MAPPER.writeValueAsString(summaryRecord(solverId, handIndex, result));
            if (log.isInfoEnabled()) {
                log.info("EPISODE_SUMMARY {}", json);
            }
        } catch (Exception e) {
            if (log.isDebugEnabled()) {
                log.debug("Failed to log episode summary", e);
            }
        }
    }

    static Map<String, Object> stepRecord(
            GameState state,
            String solverId,
            int handIndex,
            int stepIndex,
            Set<Action> legalActions,
            Action chosen,
            SearchResult search) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("type", "step");
        record.put("solver", solverId);
        record.put("hand_index", handIndex);
        record.put("step_index", stepIndex);
        // Chosen action first for easy spotting in logs
        record.put("chosen_action", chosen == null ? null : chosen.name());
        record.put("player", handRecord(state.getPlayer()));
        record.put("dealer", handRecord(state.getDealer()));
        List<String> legal = new ArrayList<>();
        for (Action action : legalActions) {
            legal.add(action.name());
        }
        record.put("legal_actions", legal);
        if (search != null) {
            record.put("stand_value", search.standValue());
            record.put("hit_value", search.hitValue());
            record.put("nodes_expanded", search.nodesExpanded());
            record.put("pruned_branches", search.prunedBranches());
        }
        return record;
    }

    static Map<String, Object> summaryRecord(String solverId, int handIndex, Game.HandResult result) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("type", "summary");
        record.put("solver", solverId);
        record.put("hand_index", handIndex);
        record.put("outcome", result.getOutcome().name());
        record.put("player", handRecord(result.getFinalState().getPlayer()));
        record.put("dealer", handRecord(result.getFinalState().getDealer()));
        record.put("hits", result.getHits());
        record.put("nodes_expanded", result.getNodesExpanded());
        record.put("duration_ms", result.getDurationNanos() / 1_000_000.0);
        return record;
    }

    private static Map<String, Object> handRecord(Hand hand) {
        Map<String, Object> record = new LinkedHashMap<>();
        List<String> cards = new ArrayList<>();
        for (Rank rank : hand.getCards()) {
            cards.add(rank.getLabel());
        }
        record.put("cards", cards);
        record.put("total", hand.getTotal());
        record.put("soft", hand.isSoft());
        return record;
    }
}
