package ai.pegs.config;

import ai.pegs.game.Board;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties for single simulations.
 *
 * Usage:
 * {@code java -jar engine.jar simulate 42 --simulation.frame-delay=100ms --simulation.board-size=7}
 */
@Component
@ConfigurationProperties(prefix = "simulation")
public class SimulationProperties {
  private int boardSize = 9;
  private Duration frameDelay = Duration.ofMillis(500);
  private boolean clearScreen = true;

  /**
   * Returns the side length of the cross-shaped board.
   * @return an odd size of at least {@link Board#MIN_SIZE}
   */
  public int getBoardSize() {
    return boardSize;
  }

  /**
   * Sets the board side length.
   * @param boardSize odd size of at least {@link Board#MIN_SIZE}
   * @throws IllegalArgumentException if the size is even or too small
   */
  public void setBoardSize(int boardSize) {
    if (boardSize % 2 == 0 || boardSize < Board.MIN_SIZE) {
      throw new IllegalArgumentException(
          "simulation.board-size must be odd and at least " + Board.MIN_SIZE + ": " + boardSize);
    }
    this.boardSize = boardSize;
  }

  /**
   * Returns the pause between animated frames.
   * @return a non-negative duration
   */
  public Duration getFrameDelay() {
    return frameDelay;
  }

  public void setFrameDelay(Duration frameDelay) {
    if (frameDelay == null || frameDelay.isNegative()) {
      throw new IllegalArgumentException("simulation.frame-delay must not be negative: " + frameDelay);
    }
    this.frameDelay = frameDelay;
  }

  /**
   * Returns whether the console is cleared before every frame.
   * @return true to redraw in place, false to print frames one after another
   */
  public boolean isClearScreen() {
    return clearScreen;
  }

  public void setClearScreen(boolean clearScreen) {
    this.clearScreen = clearScreen;
  }
}
