package org.Aayush.mazegen.grid;

import lombok.Getter;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;
import org.Aayush.mazegen.config.MazeConfig;
import org.Aayush.mazegen.generation.ArtifactPlacement;
import org.Aayush.mazegen.generation.ArtifactPlacer;
import org.Aayush.mazegen.generation.GenerationTelemetry;
import org.Aayush.mazegen.generation.LoopInjector;
import org.Aayush.mazegen.generation.MazeCarver;
import org.Aayush.mazegen.graph.GraphBuilder;
import org.Aayush.mazegen.graph.MazeGraph;
import org.Aayush.mazegen.mst.SpanningTree;
import org.Aayush.mazegen.mst.SpanningTreeSolver;
import org.Aayush.mazegen.search.RouteSearch;
import org.Aayush.mazegen.search.RouteSearchStrategy;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;

/**
 * Fixed-size rectangular maze grid.
 * <p>
 * The grid owns every mutable cell label and is the single entry point used by
 * exporters and front ends: generation, artifact placement and all structural
 * queries hang off this class. Derived values (graph, route, spanning tree) are
 * recomputed on every call and hold no reference back to the grid.
 * </p>
 * <p>
 * Cells are stored row-major in a flat array: {@code index = y * width + x}.
 * </p>
 * <p><strong>Thread Safety:</strong> Not thread-safe. A grid is mutated by one owner at a time.</p>
 */
@Slf4j
public class Grid {

    /**
     * Immutable width/height pair.
     */
    public record Size(int width, int height) {
    }

    @Getter
    @Accessors(fluent = true)
    private final int width;
    @Getter
    @Accessors(fluent = true)
    private final int height;
    @Getter
    @Accessors(fluent = true)
    private final int roomSize;
    @Getter
    @Accessors(fluent = true)
    private final ExitSide exitSide;

    private final CellLabel[] cells;

    private GenerationTelemetry lastGeneration;

    /**
     * Allocates an all-wall grid. Dimensions are normalized (see {@link GridDimensions});
     * nothing is carved until {@link #generate(Random)} runs.
     *
     * @param width requested width.
     * @param height requested height.
     * @param roomSize requested side of the central room.
     * @param exitSide exit side, {@link ExitSide#RANDOM} to pick one per generation.
     */
    public Grid(int width, int height, int roomSize, ExitSide exitSide) {
        this.exitSide = Objects.requireNonNull(exitSide, "exitSide");
        this.width = GridDimensions.constrainDimension(width);
        this.height = GridDimensions.constrainDimension(height);
        this.roomSize = GridDimensions.constrainRoomSize(roomSize, this.width, this.height);
        this.cells = new CellLabel[this.width * this.height];
        Arrays.fill(cells, CellLabel.WALL);
    }

    /**
     * Creates an all-wall grid from validated configuration.
     *
     * @param config maze configuration.
     * @return new grid.
     */
    public static Grid fromConfig(MazeConfig config) {
        Objects.requireNonNull(config, "config");
        config.validate();
        return new Grid(config.getWidth(), config.getHeight(), config.getRoomSize(), config.getExitSide());
    }

    // ========================================================================
    // CELL ACCESS
    // ========================================================================

    public Size getSize() {
        return new Size(width, height);
    }

    /**
     * Reads one cell label.
     *
     * @throws IndexOutOfBoundsException if the coordinate lies outside the grid.
     */
    public CellLabel get(int x, int y) {
        return cells[indexOf(x, y)];
    }

    public CellLabel get(Position position) {
        return get(position.x(), position.y());
    }

    /**
     * Overwrites one cell label. No transition rules are checked.
     *
     * @throws IndexOutOfBoundsException if the coordinate lies outside the grid.
     */
    public void set(int x, int y, CellLabel label) {
        cells[indexOf(x, y)] = Objects.requireNonNull(label, "label");
    }

    public void set(Position position, CellLabel label) {
        set(position.x(), position.y(), label);
    }

    /**
     * @return true when the coordinate lies inside the grid.
     */
    public boolean inBounds(int x, int y) {
        return x >= 0 && x < width && y >= 0 && y < height;
    }

    /**
     * @return true when the coordinate is inside the grid and not a wall.
     */
    public boolean isTraversable(int x, int y) {
        return inBounds(x, y) && cells[y * width + x].isTraversable();
    }

    /**
     * Counts cells that carry exactly {@code label}.
     */
    public int count(CellLabel label) {
        int count = 0;
        for (CellLabel cell : cells) {
            if (cell == label) {
                count++;
            }
        }
        return count;
    }

    /**
     * Flat row-major index of a coordinate.
     *
     * @throws IndexOutOfBoundsException if the coordinate lies outside the grid.
     */
    public int indexOf(int x, int y) {
        if (!inBounds(x, y)) {
            throw new IndexOutOfBoundsException(
                    "Cell (" + x + ", " + y + ") outside " + width + "x" + height + " grid");
        }
        return y * width + x;
    }

    // ========================================================================
    // GEOMETRY
    // ========================================================================

    public Position center() {
        return new Position(width / 2, height / 2);
    }

    public int roomMinX() {
        return width / 2 - roomSize / 2;
    }

    public int roomMaxX() {
        return width / 2 + roomSize / 2;
    }

    public int roomMinY() {
        return height / 2 - roomSize / 2;
    }

    public int roomMaxY() {
        return height / 2 + roomSize / 2;
    }

    /**
     * @return true when the coordinate lies inside the central room (inclusive bounds).
     */
    public boolean isInCenterRoom(int x, int y) {
        return x >= roomMinX() && x <= roomMaxX() && y >= roomMinY() && y <= roomMaxY();
    }

    // ========================================================================
    // MUTATION
    // ========================================================================

    /**
     * Generates a maze with an unseeded random source.
     */
    public void generate() {
        generate(new Random());
    }

    /**
     * Generates the maze in place: resets every cell to wall, carves the central room,
     * marks the exit, carves a spanning tree from the center and finally injects loops.
     *
     * @param random source for every random choice of this generation.
     */
    public void generate(Random random) {
        Objects.requireNonNull(random, "random");
        Arrays.fill(cells, CellLabel.WALL);

        MazeCarver.carveRoom(this);
        ExitSide resolvedSide = exitSide.resolve(random);
        Position exit = resolvedSide.exitPosition(width, height);
        set(exit, CellLabel.EXIT);

        int carved = MazeCarver.carve(this, center(), random);
        int requested = LoopInjector.removalTarget(this);
        log.info("Removing {} walls", requested);
        int removed = LoopInjector.inject(this, requested, random);

        lastGeneration = new GenerationTelemetry(resolvedSide, exit, carved, requested, removed);
    }

    /**
     * Places artifacts with an unseeded random source.
     */
    public ArtifactPlacement placeArtifacts(double fillRatio) {
        return placeArtifacts(fillRatio, new Random());
    }

    /**
     * Scatters reward and danger labels over path cells outside the central room.
     *
     * @param fillRatio share of path cells to fill, in {@code [0, 1]}.
     * @param random source for the position shuffle and variant choice.
     * @return requested and placed counts.
     */
    public ArtifactPlacement placeArtifacts(double fillRatio, Random random) {
        return ArtifactPlacer.place(this, fillRatio, random);
    }

    /**
     * Telemetry of the most recent {@link #generate(Random)} call.
     */
    public Optional<GenerationTelemetry> lastGeneration() {
        return Optional.ofNullable(lastGeneration);
    }

    // ========================================================================
    // QUERIES
    // ========================================================================

    /**
     * Builds a fresh graph snapshot of the current grid state.
     */
    public MazeGraph buildGraph() {
        return GraphBuilder.build(this);
    }

    /**
     * Depth-first connectivity route from the center to the exit.
     */
    public Optional<List<Position>> routeSearch() {
        return routeSearch(RouteSearchStrategy.DEPTH_FIRST);
    }

    public Optional<List<Position>> routeSearch(RouteSearchStrategy strategy) {
        return RouteSearch.search(this, strategy);
    }

    /**
     * Prim spanning tree over a freshly built graph, rooted at the center node.
     */
    public SpanningTree minimumSpanningTree() {
        return SpanningTreeSolver.solve(buildGraph());
    }
}
