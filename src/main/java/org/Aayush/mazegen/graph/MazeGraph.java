package org.Aayush.mazegen.graph;

import it.unimi.dsi.fastutil.longs.LongOpenHashSet;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.Aayush.mazegen.grid.Position;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Immutable weighted graph derived from a grid.
 * <p>
 * Nodes are dead ends, junctions, the center (id 0) and the exit (id 1); edges are
 * the corridor runs between them. The snapshot keeps no reference to its grid, so
 * any later grid mutation makes it stale rather than changing it.
 * </p>
 */
@Getter
@Accessors(fluent = true)
public final class MazeGraph {
    /** Id of the center node in a non-empty graph. */
    public static final int CENTER_ID = 0;
    /** Id of the exit node in a non-empty graph. */
    public static final int EXIT_ID = 1;

    private static final MazeGraph EMPTY = new MazeGraph(NodeIndex.empty(), List.of());

    private final NodeIndex nodes;
    private final List<GraphEdge> edges;

    /**
     * @param nodes node index.
     * @param edges edges in deterministic order; at most one per unordered node pair.
     * @throws IllegalArgumentException on unknown endpoints or duplicate pairs.
     */
    public MazeGraph(NodeIndex nodes, Collection<GraphEdge> edges) {
        this.nodes = Objects.requireNonNull(nodes, "nodes");
        Objects.requireNonNull(edges, "edges");
        LongOpenHashSet pairs = new LongOpenHashSet(edges.size());
        for (GraphEdge edge : edges) {
            Objects.requireNonNull(edge, "edge");
            if (!nodes.containsId(edge.endId())) {
                throw new IllegalArgumentException("Edge endpoint out of range: " + edge);
            }
            if (!pairs.add(edge.pairKey())) {
                throw new IllegalArgumentException("Duplicate edge for node pair: " + edge);
            }
        }
        this.edges = List.copyOf(edges);
    }

    public static MazeGraph empty() {
        return EMPTY;
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    public boolean isEmpty() {
        return nodes.size() == 0;
    }

    public int nodeId(Position position) {
        return nodes.toId(position);
    }

    public Position position(int nodeId) {
        return nodes.toPosition(nodeId);
    }

    /**
     * @return sum of all edge weights.
     */
    public long totalWeight() {
        long total = 0L;
        for (GraphEdge edge : edges) {
            total += edge.weight();
        }
        return total;
    }
}
