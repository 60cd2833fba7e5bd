package org.Aayush.mazegen.grid;

import java.util.BitSet;

/**
 * Compact set of grid cells keyed by flat cell index ({@code y * width + x}).
 * <p>
 * Wraps a {@link java.util.BitSet}: O(1) access at roughly one bit per cell.
 * </p>
 * <p>
 * <strong>Thread Safety:</strong> This class is NOT thread-safe. It is meant to live
 * inside a single generation or search call.
 * </p>
 */
public class VisitedCells {

    private final BitSet visited;

    /**
     * @param cellCount number of cells in the grid ({@code width * height}).
     */
    public VisitedCells(int cellCount) {
        if (cellCount < 0) {
            throw new IllegalArgumentException("cellCount must be non-negative");
        }
        this.visited = new BitSet(cellCount);
    }

    /**
     * Marks a cell as visited if it hasn't been visited already.
     *
     * @param cellIndex flat cell index.
     * @return {@code true} if the cell was newly marked, {@code false} if it was already visited.
     */
    public boolean markVisited(int cellIndex) {
        if (visited.get(cellIndex)) {
            return false;
        }
        visited.set(cellIndex);
        return true;
    }

    public boolean isVisited(int cellIndex) {
        return visited.get(cellIndex);
    }

    /**
     * @return number of marked cells.
     */
    public int count() {
        return visited.cardinality();
    }

    /**
     * Resets the set for reuse.
     */
    public void clear() {
        visited.clear();
    }
}
