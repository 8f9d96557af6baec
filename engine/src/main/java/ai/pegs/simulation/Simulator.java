package ai.pegs.simulation;

import ai.pegs.config.SimulationProperties;
import org.springframework.stereotype.Component;

/**
 * Runs complete simulations on the configured board size.
 */
@Component
public class Simulator {
    private final SimulationProperties properties;

    public Simulator(SimulationProperties properties) {
        this.properties = properties;
    }

    /**
     * Runs one simulation without presentation.
     *
     * @param seed seed for the offset generator
     * @return the final result
     */
    public SimulationResult simulate(long seed) {
        return Simulation.start(seed, properties.getBoardSize()).run();
    }

    /**
     * Runs one simulation, streaming every board to the presenter.
     *
     * @param seed      seed for the offset generator
     * @param presenter receives the start board, every move and the final result
     * @return the final result
     */
    public SimulationResult simulate(long seed, Presenter presenter) {
        Simulation simulation = Simulation.start(seed, properties.getBoardSize());
        presenter.started(seed, simulation.board());
        while (simulation.step()) {
            presenter.moved(simulation.lastMove(), simulation.board());
        }
        SimulationResult result = simulation.result();
        presenter.finished(result);
        return result;
    }
}
