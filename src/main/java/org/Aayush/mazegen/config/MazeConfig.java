package org.Aayush.mazegen.config;

import lombok.Builder;
import lombok.Value;
import org.Aayush.mazegen.grid.ExitSide;
import org.Aayush.mazegen.search.RouteSearchStrategy;

import java.util.Random;

/**
 * Immutable settings for one maze: grid shape, exit side, artifact density and
 * query behaviour. Width, height and room size are normalized by the grid, not here.
 */
@Value
@Builder(toBuilder = true)
public class MazeConfig {
    public static final String REASON_FILL_RATIO_RANGE = "MAZE_FILL_RATIO_RANGE";
    public static final String REASON_EXIT_SIDE_REQUIRED = "MAZE_EXIT_SIDE_REQUIRED";
    public static final String REASON_ROUTE_STRATEGY_REQUIRED = "MAZE_ROUTE_STRATEGY_REQUIRED";

    @Builder.Default
    int width = 63;

    @Builder.Default
    int height = 31;

    /** Side of the central square room. */
    @Builder.Default
    int roomSize = 3;

    @Builder.Default
    ExitSide exitSide = ExitSide.RIGHT;

    /** Share of path cells that receive an artifact, in [0, 1]. */
    @Builder.Default
    double fillRatio = 0.07d;

    @Builder.Default
    RouteSearchStrategy routeSearchStrategy = RouteSearchStrategy.DEPTH_FIRST;

    /** Random seed; {@code null} means a fresh unseeded source per run. */
    Long seed;

    /**
     * Returns the default maze settings.
     */
    public static MazeConfig defaults() {
        return MazeConfig.builder().build();
    }

    /**
     * Checks the settings that cannot be normalized silently.
     *
     * @throws MazeConfigurationException on the first violated contract.
     */
    public void validate() {
        if (exitSide == null) {
            throw new MazeConfigurationException(REASON_EXIT_SIDE_REQUIRED, "exitSide must be provided");
        }
        if (routeSearchStrategy == null) {
            throw new MazeConfigurationException(
                    REASON_ROUTE_STRATEGY_REQUIRED, "routeSearchStrategy must be provided");
        }
        if (!(fillRatio >= 0.0d && fillRatio <= 1.0d)) {
            throw new MazeConfigurationException(
                    REASON_FILL_RATIO_RANGE, "fillRatio must be in [0, 1], got " + fillRatio);
        }
    }

    /**
     * Creates the random source for one run: seeded when {@link #seed} is set.
     */
    public Random random() {
        return seed == null ? new Random() : new Random(seed);
    }
}
