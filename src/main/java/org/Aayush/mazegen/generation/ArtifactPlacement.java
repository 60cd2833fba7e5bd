package org.Aayush.mazegen.generation;

/**
 * Result of one artifact placement run. Placed counts fall short of the requested
 * counts when the exclusion rule runs out of candidate cells.
 */
public record ArtifactPlacement(
        int pathCells,
        int requestedRewards,
        int requestedDangers,
        int placedRewards,
        int placedDangers
) {
    public int requestedTotal() {
        return requestedRewards + requestedDangers;
    }

    public int placedTotal() {
        return placedRewards + placedDangers;
    }
}
