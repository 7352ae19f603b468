package ai.blackjack.config;

import ai.blackjack.player.ai.tree.GameTreeSearch;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties for the search agents.
 *
 * Usage:
 * {@code java -jar engine/target/blackjack-engine.jar --spring.profiles.active=ai-alphabeta --search.depth=6}
 */
@Component
@ConfigurationProperties(prefix = "search")
public class SearchProperties {
  private int depth = GameTreeSearch.DEFAULT_MAX_DEPTH;

  /**
   * Returns the search depth: how many extra cards a search may consider before
   * falling back to the stand evaluation.
   * @return the depth, at least 1
   */
  public int getDepth() {
    return depth;
  }

  public void setDepth(int depth) {
    this.depth = depth;
  }
}
