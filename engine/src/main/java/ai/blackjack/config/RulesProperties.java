package ai.blackjack.config;

import ai.blackjack.game.AceRule;
import ai.blackjack.game.BlackjackRules;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties for the table rules.
 *
 * <p>Defaults match {@link BlackjackRules#standard()}. Values are validated when
 * {@link #toRules()} builds the immutable rule set.
 *
 * Usage:
 * {@code java -jar engine/target/blackjack-engine.jar --rules.ace-rule=ONE --rules.dealer-stand-threshold=18}
 */
@Component
@ConfigurationProperties(prefix = "rules")
public class RulesProperties {
  private int targetTotal = BlackjackRules.DEFAULT_TARGET_TOTAL;
  private int dealerStandThreshold = BlackjackRules.DEFAULT_DEALER_STAND_THRESHOLD;
  private AceRule aceRule = AceRule.SOFT;
  private int initialCards = BlackjackRules.DEFAULT_INITIAL_CARDS;

  public int getTargetTotal() {
    return targetTotal;
  }

  public void setTargetTotal(int targetTotal) {
    this.targetTotal = targetTotal;
  }

  public int getDealerStandThreshold() {
    return dealerStandThreshold;
  }

  public void setDealerStandThreshold(int dealerStandThreshold) {
    this.dealerStandThreshold = dealerStandThreshold;
  }

  public AceRule getAceRule() {
    return aceRule;
  }

  public void setAceRule(AceRule aceRule) {
    this.aceRule = aceRule;
  }

  public int getInitialCards() {
    return initialCards;
  }

  public void setInitialCards(int initialCards) {
    this.initialCards = initialCards;
  }

  /**
   * Builds the immutable rule set.
   * @throws IllegalArgumentException if the configured values are inconsistent
   */
  public BlackjackRules toRules() {
    return new BlackjackRules(targetTotal, dealerStandThreshold, aceRule, initialCards);
  }
}
