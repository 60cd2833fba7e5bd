package org.Aayush.mazegen.app;

import org.Aayush.mazegen.config.MazeConfig;
import org.Aayush.mazegen.generation.ArtifactPlacement;
import org.Aayush.mazegen.graph.MazeGraph;
import org.Aayush.mazegen.grid.Grid;
import org.Aayush.mazegen.grid.Position;
import org.Aayush.mazegen.mst.SpanningTree;

import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * Minimal application entry point used for local smoke runs with the default settings.
 */
public class Main {
    /**
     * Generates one default maze and prints a summary of every query.
     *
     * @param args ignored.
     */
    public static void main(String[] args) {
        MazeConfig config = MazeConfig.defaults();
        Random random = config.random();

        Grid grid = Grid.fromConfig(config);
        grid.generate(random);
        ArtifactPlacement placement = grid.placeArtifacts(config.getFillRatio(), random);
        Grid.Size size = grid.getSize();
        System.out.printf("Maze %dx%d, room %d%n", size.width(), size.height(), grid.roomSize());
        System.out.printf("Artifacts placed: %d rewards, %d dangers%n",
                placement.placedRewards(), placement.placedDangers());

        Optional<List<Position>> route = grid.routeSearch(config.getRouteSearchStrategy());
        System.out.println(route
                .map(cells -> "Route length: " + cells.size())
                .orElse("Route length: none"));

        MazeGraph graph = grid.buildGraph();
        System.out.printf("Graph: %d nodes, %d edges%n", graph.nodeCount(), graph.edgeCount());

        SpanningTree tree = grid.minimumSpanningTree();
        System.out.printf("Minimum spanning tree weight: %d (%d edges)%n",
                tree.getTotalWeight(), tree.getEdges().size());
    }
}
