package ai.blackjack.player.ai;

import ai.blackjack.game.BlackjackRules;
import ai.blackjack.game.CardDraw;
import ai.blackjack.game.Hand;
import ai.blackjack.game.InfiniteDeck;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Exact distribution of the dealer's final result under the fixed dealer policy and the
 * infinite-deck model.
 *
 * <p>For a dealer hand below the stand threshold the distribution is the weighted average of
 * the distributions after each of the 13 possible next cards. Results are memoised by
 * {@link Hand.Key}, since the dealer's future depends only on its total and soft Aces.
 *
 * <p>The memo is safe to share between threads. It deliberately avoids
 * {@code computeIfAbsent}, which rejects the recursive updates this computation performs.
 */
public class DealerOutcomeTable {

    private final BlackjackRules rules;
    private final List<CardDraw> draws;
    private final Map<Hand.Key, DealerOutcomes> memo = new ConcurrentHashMap<>();

    public DealerOutcomeTable(BlackjackRules rules) {
        this(rules, InfiniteDeck.distribution());
    }

    public DealerOutcomeTable(BlackjackRules rules, List<CardDraw> draws) {
        this.rules = Objects.requireNonNull(rules, "rules");
        this.draws = Objects.requireNonNull(draws, "draws");
    }

    /**
     * Distribution of final dealer results starting from the given dealer hand.
     */
    public DealerOutcomes outcomes(Hand dealer) {
        Hand.Key key = dealer.key();
        DealerOutcomes cached = memo.get(key);
        if (cached != null) {
            return cached;
        }
        DealerOutcomes computed = compute(dealer);
        memo.put(key, computed);
        return computed;
    }

    /**
     * Number of memoised dealer hands.
     */
    public int size() {
        return memo.size();
    }

    private DealerOutcomes compute(Hand dealer) {
        int total = dealer.getTotal();
        if (rules.isBust(total)) {
            return DealerOutcomes.bust(rules);
        }
        if (total >= rules.dealerStandThreshold()) {
            return DealerOutcomes.standing(rules, total);
        }
        double[] weighted = new double[DealerOutcomes.slots(rules)];
        int totalWeight = 0;
        for (CardDraw draw : draws) {
            DealerOutcomes next = outcomes(dealer.plus(draw.rank(), rules));
            next.accumulateInto(weighted, draw.weight());
            totalWeight = draw.totalWeight();
        }
        for (int i = 0; i < weighted.length; i++) {
            weighted[i] /= totalWeight;
        }
        return new DealerOutcomes(rules, weighted);
    }

    /**
     * Probabilities of each dealer final total from the stand threshold up to the target, plus bust.
     */
    public static final class DealerOutcomes {
        private final int standThreshold;
        private final int targetTotal;
        // [standThreshold..targetTotal] followed by the bust slot.
        private final double[] probabilities;

        DealerOutcomes(BlackjackRules rules, double[] probabilities) {
            this.standThreshold = rules.dealerStandThreshold();
            this.targetTotal = rules.targetTotal();
            this.probabilities = probabilities;
        }

        static int slots(BlackjackRules rules) {
            return rules.targetTotal() - rules.dealerStandThreshold() + 2;
        }

        static DealerOutcomes bust(BlackjackRules rules) {
            double[] p = new double[slots(rules)];
            p[p.length - 1] = 1.0;
            return new DealerOutcomes(rules, p);
        }

        static DealerOutcomes standing(BlackjackRules rules, int total) {
            double[] p = new double[slots(rules)];
            p[total - rules.dealerStandThreshold()] = 1.0;
            return new DealerOutcomes(rules, p);
        }

        void accumulateInto(double[] target, int weight) {
            for (int i = 0; i < probabilities.length; i++) {
                target[i] += weight * probabilities[i];
            }
        }

        /**
         * Probability that the dealer finishes on exactly {@code total} without busting.
         */
        public double probabilityOf(int total) {
            if (total < standThreshold || total > targetTotal) {
                return 0.0;
            }
            return probabilities[total - standThreshold];
        }

        public double bustProbability() {
            return probabilities[probabilities.length - 1];
        }

        /**
         * Sum over all results; 1.0 up to rounding.
         */
        public double totalProbability() {
            double sum = 0.0;
            for (double p : probabilities) {
                sum += p;
            }
            return sum;
        }

        /**
         * Value of standing on {@code playerTotal} against this distribution:
         * P(dealer bust) + P(dealer lower) + 0.5 * P(equal).
         */
        public double standValue(int playerTotal) {
            double value = bustProbability();
            for (int total = standThreshold; total <= targetTotal; total++) {
                double p = probabilityOf(total);
                if (playerTotal > total) {
                    value += p;
                } else if (playerTotal == total) {
                    value += 0.5 * p;
                }
            }
            return value;
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder("DealerOutcomes{");
            for (int total = standThreshold; total <= targetTotal; total++) {
                sb.append(total).append('=').append(String.format("%.4f", probabilityOf(total))).append(", ");
            }
            sb.append("bust=").append(String.format("%.4f", bustProbability())).append('}');
            return sb.toString();
        }
    }
}
