package org.Aayush.mazegen.generation;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import lombok.experimental.UtilityClass;
import org.Aayush.mazegen.grid.CellLabel;
import org.Aayush.mazegen.grid.Grid;
import org.Aayush.mazegen.grid.Position;
import org.Aayush.mazegen.grid.VisitedCells;

import java.util.Objects;
import java.util.Random;

/**
 * Randomized iterative depth-first backtracking carver.
 *
 * <p>Carving moves two cells at a time so every carved cell keeps a one-cell wall
 * between itself and its lattice neighbours. The result is a spanning tree over the
 * reachable lattice rooted at the start cell.</p>
 */
@UtilityClass
public final class MazeCarver {
    // Right, left, down, up.
    private static final int[] DX = {1, -1, 0, 0};
    private static final int[] DY = {0, 0, 1, -1};

    /**
     * Carves the central square room to {@link CellLabel#PATH}.
     *
     * @param grid target grid.
     */
    public static void carveRoom(Grid grid) {
        Objects.requireNonNull(grid, "grid");
        for (int y = grid.roomMinY(); y <= grid.roomMaxY(); y++) {
            for (int x = grid.roomMinX(); x <= grid.roomMaxX(); x++) {
                grid.set(x, y, CellLabel.PATH);
            }
        }
    }

    /**
     * Runs the backtracker from {@code start}. Targets are restricted to
     * {@code [1, dim - 2]} on both axes, so the border is never carved.
     *
     * @param grid target grid.
     * @param start lattice root, normally the grid center.
     * @param random source for direction choice.
     * @return number of lattice cells visited, start included.
     */
    public static int carve(Grid grid, Position start, Random random) {
        Objects.requireNonNull(grid, "grid");
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(random, "random");

        int width = grid.width();
        int height = grid.height();
        VisitedCells visited = new VisitedCells(width * height);
        IntArrayList stack = new IntArrayList();

        int startIndex = grid.indexOf(start.x(), start.y());
        visited.markVisited(startIndex);
        stack.push(startIndex);

        int[] candidates = new int[DX.length];
        while (!stack.isEmpty()) {
            int current = stack.popInt();
            int x = current % width;
            int y = current / width;

            int candidateCount = 0;
            for (int d = 0; d < DX.length; d++) {
                int nx = x + 2 * DX[d];
                int ny = y + 2 * DY[d];
                if (nx > 0 && nx < width - 1 && ny > 0 && ny < height - 1
                        && !visited.isVisited(ny * width + nx)) {
                    candidates[candidateCount++] = d;
                }
            }
            if (candidateCount == 0) {
                continue;
            }

            stack.push(current);
            int d = candidates[random.nextInt(candidateCount)];
            int nx = x + 2 * DX[d];
            int ny = y + 2 * DY[d];
            grid.set(x + DX[d], y + DY[d], CellLabel.PATH);
            grid.set(nx, ny, CellLabel.PATH);

            int next = ny * width + nx;
            visited.markVisited(next);
            stack.push(next);
        }
        return visited.count();
    }
}
