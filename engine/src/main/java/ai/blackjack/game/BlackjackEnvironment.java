package ai.blackjack.game;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Simplified single-player Blackjack environment over an infinite deck.
 *
 * <p>Defines the legal transitions that both the game loop and the search agents use:
 * <ul>
 *     <li>dealing the initial hands,</li>
 *     <li>player actions (HIT draws one card, STAND hands the turn to the dealer),</li>
 *     <li>the dealer's fixed policy (draw while the total is at or below the hit threshold),</li>
 *     <li>scoring a finished hand.</li>
 * </ul>
 *
 * <p>The search layer never samples: it enumerates {@link #drawDistribution()} and applies each
 * rank with {@link #dealToPlayer(GameState, Rank)}. Only {@link #applyPlayerAction} with HIT,
 * {@link #initialState()} and {@link #resolveDealer(GameState)} draw from the {@link CardSource}.
 */
public class BlackjackEnvironment {
    private static final Logger log = LoggerFactory.getLogger(BlackjackEnvironment.class);

    private final BlackjackRules rules;
    private final CardSource cards;

    public BlackjackEnvironment(BlackjackRules rules, CardSource cards) {
        this.rules = Objects.requireNonNull(rules, "rules");
        this.cards = Objects.requireNonNull(cards, "cards");
    }

    /**
     * Environment with standard rules and an unseeded infinite deck.
     */
    public BlackjackEnvironment() {
        this(BlackjackRules.standard(), new InfiniteDeck());
    }

    public BlackjackRules getRules() {
        return rules;
    }

    /**
     * Deals {@link BlackjackRules#initialCards()} cards to the player, then to the dealer.
     * A two-card 21 is played as an ordinary 21.
     */
    public GameState initialState() {
        Hand player = Hand.empty();
        Hand dealer = Hand.empty();
        for (int i = 0; i < rules.initialCards(); i++) {
            player = player.plus(cards.draw(), rules);
        }
        for (int i = 0; i < rules.initialCards(); i++) {
            dealer = dealer.plus(cards.draw(), rules);
        }
        GameState state = GameState.playerTurn(player, dealer);
        if (player.isBust(rules)) {
            // Possible with fixed-eleven Aces or a larger initial deal.
            state = state.finish(Outcome.LOSE);
        }
        if (log.isDebugEnabled()) {
            log.debug("Dealt {}", state);
        }
        return state;
    }

    /**
     * HIT and STAND on the player's turn, nothing otherwise.
     */
    public Set<Action> legalActions(GameState state) {
        if (state.getTurn() != Turn.PLAYER) {
            return Collections.emptySet();
        }
        return EnumSet.allOf(Action.class);
    }

    /**
     * Applies a player action. STAND moves the turn to the dealer without drawing; HIT draws
     * one card from the card source.
     *
     * @throws IllegalArgumentException if the action is not in {@link #legalActions(GameState)}
     */
    public GameState applyPlayerAction(GameState state, Action action) {
        Objects.requireNonNull(action, "action");
        if (!legalActions(state).contains(action)) {
            throw new IllegalArgumentException("Action " + action + " is not legal in state " + state);
        }
        if (action == Action.STAND) {
            return state.withTurn(Turn.DEALER);
        }
        return dealToPlayer(state, cards.draw());
    }

    /**
     * Applies an action and, after STAND, plays the dealer out. Used by the game loop.
     */
    public GameState play(GameState state, Action action) {
        GameState next = applyPlayerAction(state, action);
        if (next.getTurn() == Turn.DEALER) {
            return resolveDealer(next);
        }
        return next;
    }

    /**
     * Distribution of the next card: all 13 ranks with equal integer weight.
     * Independent of the state under the infinite-deck model.
     */
    public List<CardDraw> drawDistribution() {
        return InfiniteDeck.distribution();
    }

    /**
     * Gives the player a specific card. A bust ends the hand as a loss; otherwise the player
     * keeps the turn.
     *
     * @throws IllegalStateException if it is not the player's turn
     */
    public GameState dealToPlayer(GameState state, Rank rank) {
        if (state.getTurn() != Turn.PLAYER) {
            throw new IllegalStateException("Cannot deal to the player when turn is " + state.getTurn());
        }
        Hand player = state.getPlayer().plus(rank, rules);
        GameState next = state.withPlayer(player);
        if (player.isBust(rules)) {
            return next.finish(Outcome.LOSE);
        }
        return next;
    }

    /**
     * Plays the dealer's fixed policy to completion: draw while the total is at or below
     * {@link BlackjackRules#dealerHitThreshold()}, then stand. Soft totals stand like hard ones.
     *
     * @return a terminal state with the scored outcome; a dealer bust is a player win
     * @throws IllegalStateException if it is not the dealer's turn
     */
    public GameState resolveDealer(GameState state) {
        if (state.getTurn() != Turn.DEALER) {
            throw new IllegalStateException("Cannot resolve the dealer when turn is " + state.getTurn());
        }
        Hand dealer = state.getDealer();
        while (dealer.getTotal() <= rules.dealerHitThreshold()) {
            dealer = dealer.plus(cards.draw(), rules);
        }
        GameState finished = state.withDealer(dealer);
        Outcome outcome = scoreOutcome(finished);
        if (log.isDebugEnabled()) {
            log.debug("Dealer finished on {}: {}", dealer, outcome);
        }
        return finished.finish(outcome);
    }

    /**
     * Scores a finished hand. A player bust loses, a dealer bust wins, otherwise the higher
     * total wins and equal totals push.
     *
     * @throws IllegalStateException if neither side has finished drawing
     */
    public Outcome scoreOutcome(GameState state) {
        int player = state.playerTotal();
        int dealer = state.dealerTotal();
        if (rules.isBust(player)) {
            return Outcome.LOSE;
        }
        if (dealer < rules.dealerStandThreshold()) {
            throw new IllegalStateException("Dealer has not finished drawing: " + state);
        }
        if (rules.isBust(dealer)) {
            return Outcome.WIN;
        }
        if (player > dealer) {
            return Outcome.WIN;
        }
        if (player < dealer) {
            return Outcome.LOSE;
        }
        return Outcome.PUSH;
    }
}
