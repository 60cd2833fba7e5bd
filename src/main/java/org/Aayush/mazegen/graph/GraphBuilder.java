package org.Aayush.mazegen.graph;

import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.longs.Long2ObjectLinkedOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import lombok.experimental.UtilityClass;
import org.Aayush.mazegen.grid.CellLabel;
import org.Aayush.mazegen.grid.Grid;
import org.Aayush.mazegen.grid.Position;

import java.util.Arrays;
import java.util.Objects;

/**
 * Derives a {@link MazeGraph} from the current state of a {@link Grid}.
 *
 * <p><strong>Pass 1 (nodes):</strong> the center becomes node 0 and the exit node 1.
 * Every interior traversable cell whose traversable-neighbour count is not exactly 2
 * (dead ends and junctions) follows in row-major order.</p>
 *
 * <p><strong>Pass 2 (edges):</strong> from each node, in each direction, the corridor is
 * walked cell by cell without re-entering a cell, summing cell weights (first stepped
 * cell included, starting node excluded) until another node is reached. A walk that
 * runs out of unvisited cells records nothing.</p>
 */
@UtilityClass
public final class GraphBuilder {
    // Right, left, down, up.
    private static final int[] DX = {1, -1, 0, 0};
    private static final int[] DY = {0, 0, 1, -1};

    /**
     * Builds a fresh graph snapshot.
     *
     * @param grid source grid.
     * @return graph, or {@link MazeGraph#empty()} when no exit lies on the left/right border column.
     */
    public static MazeGraph build(Grid grid) {
        Objects.requireNonNull(grid, "grid");
        Position exit = findExit(grid);
        if (exit == null) {
            return MazeGraph.empty();
        }

        int width = grid.width();
        int height = grid.height();
        Position center = grid.center();

        ObjectArrayList<Position> positions = new ObjectArrayList<>();
        positions.add(center);
        positions.add(exit);
        for (int y = 1; y < height - 1; y++) {
            for (int x = 1; x < width - 1; x++) {
                if (!grid.get(x, y).isTraversable()) {
                    continue;
                }
                Position position = new Position(x, y);
                if (position.equals(center) || position.equals(exit)) {
                    continue;
                }
                if (traversableNeighbours(grid, x, y) != 2) {
                    positions.add(position);
                }
            }
        }
        NodeIndex nodes = new NodeIndex(positions);

        // cell index -> node id, -1 for corridor cells
        int[] nodeIdByCell = new int[width * height];
        Arrays.fill(nodeIdByCell, -1);
        for (int id = 0; id < positions.size(); id++) {
            Position position = positions.get(id);
            nodeIdByCell[position.y() * width + position.x()] = id;
        }

        Long2ObjectLinkedOpenHashMap<GraphEdge> edges = new Long2ObjectLinkedOpenHashMap<>();
        IntOpenHashSet walked = new IntOpenHashSet();
        for (int startId = 0; startId < positions.size(); startId++) {
            Position start = positions.get(startId);
            for (int d = 0; d < DX.length; d++) {
                walked.clear();
                walkCorridor(grid, nodeIdByCell, walked, startId, start, DX[d], DY[d], edges);
            }
        }
        return new MazeGraph(nodes, edges.values());
    }

    /**
     * Scans the left then the right border column for an exit cell; the last match wins.
     */
    static Position findExit(Grid grid) {
        Position exit = null;
        int[] columns = {0, grid.width() - 1};
        for (int x : columns) {
            for (int y = 0; y < grid.height(); y++) {
                if (grid.get(x, y) == CellLabel.EXIT) {
                    exit = new Position(x, y);
                    break;
                }
            }
        }
        return exit;
    }

    private static int traversableNeighbours(Grid grid, int x, int y) {
        int count = 0;
        for (int d = 0; d < DX.length; d++) {
            if (grid.isTraversable(x + DX[d], y + DY[d])) {
                count++;
            }
        }
        return count;
    }

    /**
     * Follows one corridor out of {@code start} in direction {@code (dx, dy)}.
     * Only walks that start at the lower id record their edge, so each weight is
     * measured from a fixed side; parallel corridors keep the lighter edge.
     */
    private static void walkCorridor(
            Grid grid,
            int[] nodeIdByCell,
            IntOpenHashSet walked,
            int startId,
            Position start,
            int dx,
            int dy,
            Long2ObjectLinkedOpenHashMap<GraphEdge> edges
    ) {
        int width = grid.width();
        int x = start.x() + dx;
        int y = start.y() + dy;
        if (!grid.isTraversable(x, y)) {
            return;
        }
        int weight = grid.get(x, y).weight();
        walked.add(start.y() * width + start.x());

        while (true) {
            int cell = y * width + x;
            int endId = nodeIdByCell[cell];
            if (endId >= 0) {
                if (startId < endId) {
                    record(edges, new GraphEdge(startId, endId, weight));
                }
                return;
            }
            walked.add(cell);

            boolean advanced = false;
            for (int d = 0; d < DX.length; d++) {
                int nx = x + DX[d];
                int ny = y + DY[d];
                if (grid.isTraversable(nx, ny) && !walked.contains(ny * width + nx)) {
                    x = nx;
                    y = ny;
                    weight += grid.get(nx, ny).weight();
                    advanced = true;
                    break;
                }
            }
            if (!advanced) {
                return;
            }
        }
    }

    private static void record(Long2ObjectLinkedOpenHashMap<GraphEdge> edges, GraphEdge edge) {
        long key = edge.pairKey();
        GraphEdge existing = edges.get(key);
        if (existing == null || edge.weight() < existing.weight()) {
            edges.put(key, edge);
        }
    }
}
