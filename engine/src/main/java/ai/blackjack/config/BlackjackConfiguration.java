package ai.blackjack.config;

import ai.blackjack.game.BlackjackEnvironment;
import ai.blackjack.game.BlackjackRules;
import ai.blackjack.game.InfiniteDeck;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the rule set and the environment from configuration properties.
 */
@Configuration
public class BlackjackConfiguration {
  private static final Logger log = LoggerFactory.getLogger(BlackjackConfiguration.class);

  @Bean
  public BlackjackRules blackjackRules(RulesProperties properties) {
    BlackjackRules rules = properties.toRules();
    log.info("Using rules {}", rules);
    return rules;
  }

  @Bean
  public BlackjackEnvironment blackjackEnvironment(BlackjackRules rules, GameProperties game) {
    InfiniteDeck deck = game.getSeed() == null ? new InfiniteDeck() : new InfiniteDeck(game.getSeed());
    return new BlackjackEnvironment(rules, deck);
  }
}
