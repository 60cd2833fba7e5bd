package org.Aayush.mazegen.generation;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.Aayush.mazegen.grid.CellLabel;
import org.Aayush.mazegen.grid.Grid;
import org.Aayush.mazegen.grid.VisitedCells;

import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Scatters reward and danger labels over path cells outside the central room.
 *
 * <p>Placement is greedy over a shuffled candidate list: rewards first, then dangers.
 * A cell is skipped when it, or one of its four orthogonal neighbours, already holds
 * an artifact, so no two artifacts ever touch. Artifacts left by an earlier call count
 * too, so repeated placement on one grid keeps the rule. Running out of candidates ends
 * placement early without error.</p>
 */
@Slf4j
@UtilityClass
public final class ArtifactPlacer {
    /** Share of the target count that goes to rewards; the remainder are dangers. */
    public static final double REWARD_RATIO = 0.4;

    private static final int[] DX = {1, -1, 0, 0};
    private static final int[] DY = {0, 0, 1, -1};

    /**
     * Places artifacts in place.
     *
     * @param grid generated grid.
     * @param fillRatio share of {@link CellLabel#PATH} cells to fill, in {@code [0, 1]}.
     * @param random source for the shuffle and the variant choice.
     * @return requested and placed counts.
     * @throws IllegalArgumentException when {@code fillRatio} is NaN or outside {@code [0, 1]}.
     */
    public static ArtifactPlacement place(Grid grid, double fillRatio, Random random) {
        Objects.requireNonNull(grid, "grid");
        Objects.requireNonNull(random, "random");
        if (!(fillRatio >= 0.0d && fillRatio <= 1.0d)) {
            throw new IllegalArgumentException("fillRatio must be in [0, 1], got " + fillRatio);
        }

        int pathCells = grid.count(CellLabel.PATH);
        int target = (int) Math.floor(pathCells * fillRatio);
        int rewardCount = (int) Math.floor(target * REWARD_RATIO);
        int dangerCount = target - rewardCount;

        int[] candidates = collectCandidates(grid);
        shuffle(candidates, random);

        VisitedCells blocked = blockExistingArtifacts(grid);
        int placedRewards = placeKind(grid, candidates, blocked, CellLabel.rewards(), rewardCount, random);
        int placedDangers = placeKind(grid, candidates, blocked, CellLabel.dangers(), dangerCount, random);

        log.debug("Artifacts requested {}/{} (rewards/dangers), placed {}/{}",
                rewardCount, dangerCount, placedRewards, placedDangers);
        return new ArtifactPlacement(pathCells, rewardCount, dangerCount, placedRewards, placedDangers);
    }

    /**
     * Row-major list of path cells outside the central room, as flat indices.
     */
    private static int[] collectCandidates(Grid grid) {
        IntArrayList candidates = new IntArrayList();
        for (int y = 0; y < grid.height(); y++) {
            for (int x = 0; x < grid.width(); x++) {
                if (grid.get(x, y) == CellLabel.PATH && !grid.isInCenterRoom(x, y)) {
                    candidates.add(y * grid.width() + x);
                }
            }
        }
        return candidates.toIntArray();
    }

    /**
     * Blocks every cell that already holds an artifact, with its orthogonal neighbours.
     */
    private static VisitedCells blockExistingArtifacts(Grid grid) {
        VisitedCells blocked = new VisitedCells(grid.width() * grid.height());
        for (int y = 0; y < grid.height(); y++) {
            for (int x = 0; x < grid.width(); x++) {
                if (grid.get(x, y).isArtifact()) {
                    blockAround(grid, blocked, x, y);
                }
            }
        }
        return blocked;
    }

    private static void blockAround(Grid grid, VisitedCells blocked, int x, int y) {
        int width = grid.width();
        blocked.markVisited(y * width + x);
        for (int d = 0; d < DX.length; d++) {
            int nx = x + DX[d];
            int ny = y + DY[d];
            if (grid.inBounds(nx, ny)) {
                blocked.markVisited(ny * width + nx);
            }
        }
    }

    /**
     * In-place Fisher-Yates shuffle.
     */
    private static void shuffle(int[] array, Random random) {
        for (int i = array.length - 1; i > 0; i--) {
            int j = random.nextInt(i + 1);
            int tmp = array[i];
            array[i] = array[j];
            array[j] = tmp;
        }
    }

    /**
     * Walks the shuffled candidates from the first entry and places up to {@code count} labels
     * drawn from {@code variants}.
     */
    private static int placeKind(
            Grid grid,
            int[] candidates,
            VisitedCells blocked,
            List<CellLabel> variants,
            int count,
            Random random
    ) {
        int width = grid.width();
        int placed = 0;
        for (int i = 0; i < candidates.length && placed < count; i++) {
            int cell = candidates[i];
            if (blocked.isVisited(cell)) {
                continue;
            }
            int x = cell % width;
            int y = cell / width;
            grid.set(x, y, variants.get(random.nextInt(variants.size())));
            placed++;
            blockAround(grid, blocked, x, y);
        }
        return placed;
    }
}
