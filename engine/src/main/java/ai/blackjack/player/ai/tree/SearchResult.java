package ai.blackjack.player.ai.tree;

import ai.blackjack.game.Action;

/**
 * Outcome of one root decision.
 *
 * @param action        the chosen action (STAND on ties)
 * @param standValue    exact value of standing now
 * @param hitValue      value of hitting; with alpha-beta pruning this is exact only when it
 *                      exceeds {@code standValue}, otherwise an upper bound
 * @param nodesExpanded player (MAX) nodes visited, the root included
 * @param prunedBranches deck branches skipped by pruning (always 0 without pruning)
 */
public record SearchResult(Action action, double standValue, double hitValue, long nodesExpanded,
        long prunedBranches) {

    /**
     * Value of the root: the better of the two actions.
     */
    public double value() {
        return Math.max(standValue, hitValue);
    }
}
