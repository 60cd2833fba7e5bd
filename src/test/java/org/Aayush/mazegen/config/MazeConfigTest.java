package org.Aayush.mazegen.config;

import org.Aayush.mazegen.grid.ExitSide;
import org.Aayush.mazegen.grid.Grid;
import org.Aayush.mazegen.search.RouteSearchStrategy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MazeConfig Tests")
class MazeConfigTest {

    @Test
    @DisplayName("Defaults describe a 63x31 maze with a right-hand exit")
    void testDefaults() {
        MazeConfig config = MazeConfig.defaults();
        assertEquals(63, config.getWidth());
        assertEquals(31, config.getHeight());
        assertEquals(3, config.getRoomSize());
        assertEquals(ExitSide.RIGHT, config.getExitSide());
        assertEquals(0.07d, config.getFillRatio());
        assertEquals(RouteSearchStrategy.DEPTH_FIRST, config.getRouteSearchStrategy());
        assertNull(config.getSeed());
        assertDoesNotThrow(config::validate);
    }

    @Test
    @DisplayName("Grid creation normalizes dimensions silently")
    void testFromConfigNormalizes() {
        MazeConfig config = MazeConfig.builder().width(60).height(2).roomSize(40).build();
        Grid grid = Grid.fromConfig(config);
        assertEquals(new Grid.Size(63, 7), grid.getSize());
        assertEquals(5, grid.roomSize());
    }

    @Test
    @DisplayName("Fill ratio outside [0, 1] is rejected with a reason code")
    void testFillRatioRejected() {
        MazeConfig config = MazeConfig.builder().fillRatio(1.5d).build();
        MazeConfigurationException ex = assertThrows(MazeConfigurationException.class, config::validate);
        assertEquals(MazeConfig.REASON_FILL_RATIO_RANGE, ex.reasonCode());
        assertTrue(ex.getMessage().startsWith("[" + MazeConfig.REASON_FILL_RATIO_RANGE + "]"));

        MazeConfig nan = MazeConfig.builder().fillRatio(Double.NaN).build();
        assertThrows(MazeConfigurationException.class, () -> Grid.fromConfig(nan));
    }

    @Test
    @DisplayName("Missing exit side and route strategy are rejected")
    void testRequiredFields() {
        MazeConfigurationException exit = assertThrows(MazeConfigurationException.class,
                () -> MazeConfig.builder().exitSide(null).build().validate());
        assertEquals(MazeConfig.REASON_EXIT_SIDE_REQUIRED, exit.reasonCode());

        MazeConfigurationException strategy = assertThrows(MazeConfigurationException.class,
                () -> MazeConfig.builder().routeSearchStrategy(null).build().validate());
        assertEquals(MazeConfig.REASON_ROUTE_STRATEGY_REQUIRED, strategy.reasonCode());
    }

    @Test
    @DisplayName("Seeded configuration reproduces the same maze")
    void testSeededReproduction() {
        MazeConfig config = MazeConfig.defaults().toBuilder()
                .width(23)
                .height(15)
                .exitSide(ExitSide.RANDOM)
                .seed(99L)
                .build();

        Grid first = Grid.fromConfig(config);
        Grid second = Grid.fromConfig(config);
        first.generate(config.random());
        second.generate(config.random());

        for (int y = 0; y < first.height(); y++) {
            for (int x = 0; x < first.width(); x++) {
                assertEquals(first.get(x, y), second.get(x, y));
            }
        }
    }
}
