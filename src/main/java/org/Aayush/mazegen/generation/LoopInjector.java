package org.Aayush.mazegen.generation;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import lombok.experimental.UtilityClass;
import org.Aayush.mazegen.grid.CellLabel;
import org.Aayush.mazegen.grid.Grid;

import java.util.Objects;
import java.util.Random;

/**
 * Opens a bounded number of interior walls so the carved tree gains cycles.
 */
@UtilityClass
public final class LoopInjector {

    /**
     * Number of walls one generation tries to remove: {@code (width + height) / 8}.
     */
    public static int removalTarget(Grid grid) {
        return (grid.width() + grid.height()) / 8;
    }

    /**
     * Runs {@code attempts} passes. Each pass re-scans the interior for candidate walls and
     * opens one of them uniformly at random; a pass without candidates does nothing.
     *
     * @param grid carved grid.
     * @param attempts number of passes.
     * @param random source for the wall choice.
     * @return number of walls actually opened.
     */
    public static int inject(Grid grid, int attempts, Random random) {
        Objects.requireNonNull(grid, "grid");
        Objects.requireNonNull(random, "random");

        int width = grid.width();
        int removed = 0;
        IntArrayList candidates = new IntArrayList();
        for (int attempt = 0; attempt < attempts; attempt++) {
            candidates.clear();
            for (int y = 1; y < grid.height() - 1; y++) {
                for (int x = 1; x < width - 1; x++) {
                    if (isCandidate(grid, x, y)) {
                        candidates.add(y * width + x);
                    }
                }
            }
            if (candidates.isEmpty()) {
                continue;
            }
            int chosen = candidates.getInt(random.nextInt(candidates.size()));
            grid.set(chosen % width, chosen / width, CellLabel.PATH);
            removed++;
        }
        return removed;
    }

    /**
     * An interior wall qualifies when exactly two of its orthogonal neighbours are
     * {@link CellLabel#PATH} and those two sit on opposite sides (left+right or up+down).
     * Caller guarantees {@code (x, y)} is not on the border.
     */
    public static boolean isCandidate(Grid grid, int x, int y) {
        if (grid.get(x, y) != CellLabel.WALL) {
            return false;
        }
        boolean right = grid.get(x + 1, y) == CellLabel.PATH;
        boolean left = grid.get(x - 1, y) == CellLabel.PATH;
        boolean down = grid.get(x, y + 1) == CellLabel.PATH;
        boolean up = grid.get(x, y - 1) == CellLabel.PATH;

        int adjacentPaths = (right ? 1 : 0) + (left ? 1 : 0) + (down ? 1 : 0) + (up ? 1 : 0);
        if (adjacentPaths != 2) {
            return false;
        }
        return (right && left) || (down && up);
    }
}
