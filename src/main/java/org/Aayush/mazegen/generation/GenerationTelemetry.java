package org.Aayush.mazegen.generation;

import org.Aayush.mazegen.grid.ExitSide;
import org.Aayush.mazegen.grid.Position;

/**
 * Immutable summary of one maze generation.
 *
 * @param exitSide concrete side the exit was placed on.
 * @param exitPosition border cell labelled as exit.
 * @param carvedLatticeCells lattice cells reached by the carver, start included.
 * @param wallRemovalsRequested loop-injection passes attempted.
 * @param wallsRemoved walls actually opened by loop injection.
 */
public record GenerationTelemetry(
        ExitSide exitSide,
        Position exitPosition,
        int carvedLatticeCells,
        int wallRemovalsRequested,
        int wallsRemoved
) {
}
