package ai.blackjack.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties for a command-line session.
 *
 * Usage:
 * {@code java -jar engine/target/blackjack-engine.jar --spring.profiles.active=ai-minimax --game.hands=1000 --game.seed=42}
 */
@Component
@ConfigurationProperties(prefix = "game")
public class GameProperties {
  private int hands = 1;
  private Long seed;

  /**
   * Number of hands to play in one run.
   */
  public int getHands() {
    return hands;
  }

  public void setHands(int hands) {
    this.hands = hands;
  }

  /**
   * Seed for the infinite deck, or null for a random seed.
   */
  public Long getSeed() {
    return seed;
  }

  public void setSeed(Long seed) {
    this.seed = seed;
  }
}
