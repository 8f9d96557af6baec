package ai.pegs.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties for the best-seed search ({@code find}).
 *
 * Usage:
 * {@code java -jar engine.jar find --search.threads=4 --search.batch-size=50000}
 */
@Component
@ConfigurationProperties(prefix = "search")
public class SearchProperties {
  private int batchSize = 100_000;
  private int threads = 1;
  private int maxBatches = 0;

  /**
   * Returns how many runs make up one reporting batch.
   * @return a positive run count
   */
  public int getBatchSize() {
    return batchSize;
  }

  public void setBatchSize(int batchSize) {
    if (batchSize <= 0) {
      throw new IllegalArgumentException("search.batch-size must be positive: " + batchSize);
    }
    this.batchSize = batchSize;
  }

  /**
   * Returns the number of worker threads running simulations.
   * @return 1 for a strictly sequential search
   */
  public int getThreads() {
    return threads;
  }

  public void setThreads(int threads) {
    if (threads <= 0) {
      throw new IllegalArgumentException("search.threads must be positive: " + threads);
    }
    this.threads = threads;
  }

  /**
   * Returns the number of batches after which the search gives up.
   * @return 0 to search until a winning seed is found
   */
  public int getMaxBatches() {
    return maxBatches;
  }

  public void setMaxBatches(int maxBatches) {
    if (maxBatches < 0) {
      throw new IllegalArgumentException("search.max-batches must not be negative: " + maxBatches);
    }
    this.maxBatches = maxBatches;
  }
}
