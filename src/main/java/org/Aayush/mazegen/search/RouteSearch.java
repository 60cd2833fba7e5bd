package org.Aayush.mazegen.search;

import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.Aayush.mazegen.grid.CellLabel;
import org.Aayush.mazegen.grid.Grid;
import org.Aayush.mazegen.grid.Position;
import org.Aayush.mazegen.grid.VisitedCells;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Finds a route from the maze center to the exit directly over the grid.
 * <p>
 * The work list is seeded with the center and with every edge cell of the central room
 * that has a traversable neighbour outside the room. Cells are marked visited when they
 * are pushed, never when they are popped, so each cell enters the work list at most once.
 * The returned route starts at whichever seed led to the exit.
 * </p>
 * <p>
 * With {@link RouteSearchStrategy#DEPTH_FIRST} the center is explored first and the room
 * seeds later; this is a connectivity search, not a shortest-path search.
 * </p>
 */
@Slf4j
@UtilityClass
public final class RouteSearch {
    // Right, left, down, up.
    private static final int[] DX = {1, -1, 0, 0};
    private static final int[] DY = {0, 0, 1, -1};
    private static final int NO_PARENT = -1;

    /**
     * Searches for the exit.
     *
     * @param grid grid to search.
     * @param strategy work-list discipline.
     * @return cells from a seed to the exit inclusive, or empty when the exit is unreachable.
     */
    public static Optional<List<Position>> search(Grid grid, RouteSearchStrategy strategy) {
        Objects.requireNonNull(grid, "grid");
        Objects.requireNonNull(strategy, "strategy");

        int width = grid.width();
        int cellCount = width * grid.height();
        VisitedCells visited = new VisitedCells(cellCount);
        int[] parent = new int[cellCount];
        Arrays.fill(parent, NO_PARENT);

        Position center = grid.center();
        int start = grid.indexOf(center.x(), center.y());
        visited.markVisited(start);
        IntArrayList roomSeeds = collectRoomSeeds(grid, visited);

        WorkList workList = strategy == RouteSearchStrategy.DEPTH_FIRST
                ? new StackWorkList()
                : new QueueWorkList();
        workList.seed(start, roomSeeds);

        while (!workList.isEmpty()) {
            int cell = workList.next();
            int x = cell % width;
            int y = cell / width;
            if (grid.get(x, y) == CellLabel.EXIT) {
                return Optional.of(reconstruct(parent, cell, width));
            }
            for (int d = 0; d < DX.length; d++) {
                int nx = x + DX[d];
                int ny = y + DY[d];
                if (!grid.isTraversable(nx, ny)) {
                    continue;
                }
                int next = ny * width + nx;
                if (visited.markVisited(next)) {
                    parent[next] = cell;
                    workList.add(next);
                }
            }
        }
        log.debug("No route from {} to the exit ({} cells explored)", center, visited.count());
        return Optional.empty();
    }

    /**
     * Row-major edge cells of the central room with at least one traversable neighbour
     * outside the room. Seeds are marked visited here.
     */
    private static IntArrayList collectRoomSeeds(Grid grid, VisitedCells visited) {
        IntArrayList seeds = new IntArrayList();
        int width = grid.width();
        for (int y = grid.roomMinY(); y <= grid.roomMaxY(); y++) {
            for (int x = grid.roomMinX(); x <= grid.roomMaxX(); x++) {
                boolean onEdge = x == grid.roomMinX() || x == grid.roomMaxX()
                        || y == grid.roomMinY() || y == grid.roomMaxY();
                if (!onEdge || !leadsOutOfRoom(grid, x, y)) {
                    continue;
                }
                int cell = y * width + x;
                if (visited.markVisited(cell)) {
                    seeds.add(cell);
                }
            }
        }
        return seeds;
    }

    private static boolean leadsOutOfRoom(Grid grid, int x, int y) {
        for (int d = 0; d < DX.length; d++) {
            int nx = x + DX[d];
            int ny = y + DY[d];
            if (grid.isTraversable(nx, ny) && !grid.isInCenterRoom(nx, ny)) {
                return true;
            }
        }
        return false;
    }

    private static List<Position> reconstruct(int[] parent, int target, int width) {
        List<Position> route = new ArrayList<>();
        for (int cell = target; cell != NO_PARENT; cell = parent[cell]) {
            route.add(new Position(cell % width, cell / width));
        }
        Collections.reverse(route);
        return List.copyOf(route);
    }

    private interface WorkList {
        void seed(int start, IntArrayList roomSeeds);

        void add(int cell);

        int next();

        boolean isEmpty();
    }

    /**
     * LIFO: room seeds sit below the center so they are popped after it.
     */
    private static final class StackWorkList implements WorkList {
        private final IntArrayList stack = new IntArrayList();

        @Override
        public void seed(int start, IntArrayList roomSeeds) {
            for (int i = roomSeeds.size() - 1; i >= 0; i--) {
                stack.push(roomSeeds.getInt(i));
            }
            stack.push(start);
        }

        @Override
        public void add(int cell) {
            stack.push(cell);
        }

        @Override
        public int next() {
            return stack.popInt();
        }

        @Override
        public boolean isEmpty() {
            return stack.isEmpty();
        }
    }

    /**
     * FIFO: center first, then room seeds in scan order.
     */
    private static final class QueueWorkList implements WorkList {
        private final IntArrayFIFOQueue queue = new IntArrayFIFOQueue();

        @Override
        public void seed(int start, IntArrayList roomSeeds) {
            queue.enqueue(start);
            for (int i = 0; i < roomSeeds.size(); i++) {
                queue.enqueue(roomSeeds.getInt(i));
            }
        }

        @Override
        public void add(int cell) {
            queue.enqueue(cell);
        }

        @Override
        public int next() {
            return queue.dequeueInt();
        }

        @Override
        public boolean isEmpty() {
            return queue.isEmpty();
        }
    }
}
