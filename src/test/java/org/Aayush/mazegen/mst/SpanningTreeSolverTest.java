package org.Aayush.mazegen.mst;

import org.Aayush.mazegen.graph.GraphEdge;
import org.Aayush.mazegen.graph.MazeGraph;
import org.Aayush.mazegen.graph.NodeIndex;
import org.Aayush.mazegen.grid.CellLabel;
import org.Aayush.mazegen.grid.ExitSide;
import org.Aayush.mazegen.grid.Grid;
import org.Aayush.mazegen.grid.Position;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SpanningTreeSolver Tests")
class SpanningTreeSolverTest {

    private static NodeIndex nodes(int count) {
        List<Position> positions = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            positions.add(new Position(i, 0));
        }
        return new NodeIndex(positions);
    }

    @Test
    @DisplayName("Prim weight matches brute-force enumeration on small random graphs")
    void testMatchesBruteForce() {
        Random random = new Random(2024L);
        for (int trial = 0; trial < 200; trial++) {
            int nodeCount = 2 + random.nextInt(5);
            MazeGraph graph = randomConnectedGraph(nodeCount, random);

            SpanningTree tree = SpanningTreeSolver.solve(graph);

            assertTrue(tree.spansAllNodes(), "trial " + trial);
            assertEquals(nodeCount - 1, tree.getEdges().size());
            assertTrue(isSpanningTree(nodeCount, tree.getEdges()));
            assertEquals(bruteForceMinimum(nodeCount, graph.edges()), tree.getTotalWeight(), "trial " + trial);
        }
    }

    private MazeGraph randomConnectedGraph(int nodeCount, Random random) {
        List<GraphEdge> edges = new ArrayList<>();
        boolean[][] present = new boolean[nodeCount][nodeCount];
        // Random backbone keeps the graph connected.
        for (int node = 1; node < nodeCount; node++) {
            int other = random.nextInt(node);
            edges.add(GraphEdge.between(other, node, random.nextInt(16) - 6));
            present[other][node] = true;
        }
        for (int a = 0; a < nodeCount; a++) {
            for (int b = a + 1; b < nodeCount; b++) {
                if (!present[a][b] && random.nextBoolean()) {
                    edges.add(new GraphEdge(a, b, random.nextInt(16) - 6));
                }
            }
        }
        return new MazeGraph(nodes(nodeCount), edges);
    }

    private long bruteForceMinimum(int nodeCount, List<GraphEdge> edges) {
        long best = Long.MAX_VALUE;
        int subsets = 1 << edges.size();
        for (int mask = 0; mask < subsets; mask++) {
            if (Integer.bitCount(mask) != nodeCount - 1) {
                continue;
            }
            List<GraphEdge> chosen = new ArrayList<>();
            long weight = 0L;
            for (int i = 0; i < edges.size(); i++) {
                if ((mask & (1 << i)) != 0) {
                    chosen.add(edges.get(i));
                    weight += edges.get(i).weight();
                }
            }
            if (weight < best && isSpanningTree(nodeCount, chosen)) {
                best = weight;
            }
        }
        return best;
    }

    private boolean isSpanningTree(int nodeCount, List<GraphEdge> edges) {
        int[] parent = new int[nodeCount];
        for (int i = 0; i < nodeCount; i++) {
            parent[i] = i;
        }
        for (GraphEdge edge : edges) {
            int a = find(parent, edge.startId());
            int b = find(parent, edge.endId());
            if (a == b) {
                return false;
            }
            parent[a] = b;
        }
        return edges.size() == nodeCount - 1;
    }

    private int find(int[] parent, int node) {
        while (parent[node] != node) {
            node = parent[node];
        }
        return node;
    }

    @Test
    @DisplayName("Empty graph: no edges, zero weight")
    void testEmptyGraph() {
        SpanningTree tree = SpanningTreeSolver.solve(MazeGraph.empty());
        assertTrue(tree.getEdges().isEmpty());
        assertEquals(0L, tree.getTotalWeight());
        assertEquals(0, tree.getNodes().size());
    }

    @Test
    @DisplayName("Disconnected graph: partial tree of the center's component")
    void testDisconnectedGraph() {
        MazeGraph graph = new MazeGraph(nodes(4), List.of(
                new GraphEdge(0, 1, 5),
                new GraphEdge(2, 3, 1)
        ));

        SpanningTree tree = SpanningTreeSolver.solve(graph);

        assertEquals(List.of(new GraphEdge(0, 1, 5)), tree.getEdges());
        assertEquals(2, tree.getReachedNodeCount());
        assertFalse(tree.spansAllNodes());
        assertEquals(4, tree.getNodes().size());
    }

    @Test
    @DisplayName("Tie-break: first edge in graph order wins")
    void testTieBreak() {
        MazeGraph graph = new MazeGraph(nodes(3), List.of(
                new GraphEdge(0, 2, 3),
                new GraphEdge(0, 1, 3),
                new GraphEdge(1, 2, 4)
        ));

        SpanningTree tree = SpanningTreeSolver.solve(graph);

        assertEquals(List.of(new GraphEdge(0, 2, 3), new GraphEdge(0, 1, 3)), tree.getEdges());
        assertEquals(6L, tree.getTotalWeight());
    }

    @Test
    @DisplayName("Hand-built T junction: tree takes all three corridors")
    void testTJunctionTree() {
        Grid grid = new Grid(7, 7, 1, ExitSide.RIGHT);
        grid.set(3, 3, CellLabel.PATH);
        grid.set(4, 3, CellLabel.GHOST);
        grid.set(5, 3, CellLabel.PATH);
        grid.set(5, 2, CellLabel.BAT);
        grid.set(5, 1, CellLabel.PATH);
        grid.set(6, 3, CellLabel.EXIT);

        SpanningTree tree = grid.minimumSpanningTree();

        assertEquals(List.of(
                new GraphEdge(0, 3, 6),
                new GraphEdge(1, 3, 0),
                new GraphEdge(2, 3, 1)
        ), tree.getEdges());
        assertEquals(7L, tree.getTotalWeight());
        assertTrue(tree.spansAllNodes());
    }

    @Test
    @DisplayName("Generated maze: tree spans every node and is no heavier than any graph-order spanning tree")
    void testGeneratedMaze() {
        Random random = new Random(31L);
        Grid grid = new Grid(31, 23, 3, ExitSide.LEFT);
        grid.generate(random);
        grid.placeArtifacts(0.1, random);

        MazeGraph graph = grid.buildGraph();
        SpanningTree tree = grid.minimumSpanningTree();

        assertEquals(graph.nodeCount(), tree.getNodes().size());
        assertEquals(tree.getReachedNodeCount() - 1, tree.getEdges().size());
        assertTrue(tree.spansAllNodes());
        assertTrue(graph.edges().containsAll(tree.getEdges()));

        long treeWeight = 0L;
        for (GraphEdge edge : tree.getEdges()) {
            treeWeight += edge.weight();
        }
        assertEquals(treeWeight, tree.getTotalWeight());
        assertTrue(tree.getTotalWeight() <= firstFitSpanningWeight(graph));
    }

    /**
     * Weight of the spanning tree that takes each graph edge, in graph order, whenever it joins two components.
     */
    private long firstFitSpanningWeight(MazeGraph graph) {
        int[] parent = new int[graph.nodeCount()];
        for (int i = 0; i < parent.length; i++) {
            parent[i] = i;
        }
        long weight = 0L;
        for (GraphEdge edge : graph.edges()) {
            int a = find(parent, edge.startId());
            int b = find(parent, edge.endId());
            if (a != b) {
                parent[a] = b;
                weight += edge.weight();
            }
        }
        return weight;
    }
}
