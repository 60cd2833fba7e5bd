package org.Aayush.mazegen.mst;

import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.Aayush.mazegen.graph.GraphEdge;
import org.Aayush.mazegen.graph.MazeGraph;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Prim's minimum spanning tree rooted at the center node.
 *
 * <p>Each round re-scans every edge for the lightest one with exactly one visited
 * endpoint, giving {@code O(V * E)} per run. Ties go to the edge that comes first in
 * the graph's edge order. A disconnected graph yields the partial tree built so far.</p>
 */
@Slf4j
@UtilityClass
public final class SpanningTreeSolver {

    public static SpanningTree solve(MazeGraph graph) {
        Objects.requireNonNull(graph, "graph");
        if (graph.isEmpty()) {
            return new SpanningTree(graph.nodes(), List.of(), 0L, 0);
        }

        int nodeCount = graph.nodeCount();
        boolean[] visited = new boolean[nodeCount];
        visited[MazeGraph.CENTER_ID] = true;
        int visitedCount = 1;

        List<GraphEdge> treeEdges = new ArrayList<>();
        long totalWeight = 0L;
        while (visitedCount < nodeCount) {
            GraphEdge best = null;
            for (GraphEdge edge : graph.edges()) {
                if (visited[edge.startId()] == visited[edge.endId()]) {
                    continue;
                }
                if (best == null || edge.weight() < best.weight()) {
                    best = edge;
                }
            }
            if (best == null) {
                break;
            }
            visited[best.startId()] = true;
            visited[best.endId()] = true;
            visitedCount++;
            treeEdges.add(best);
            totalWeight += best.weight();
        }

        log.info("Minimum spanning tree weight: {}", totalWeight);
        if (log.isDebugEnabled()) {
            for (GraphEdge edge : treeEdges) {
                log.debug("Edge from {} to {} with weight {}", edge.startId(), edge.endId(), edge.weight());
            }
        }
        return new SpanningTree(graph.nodes(), List.copyOf(treeEdges), totalWeight, visitedCount);
    }
}
