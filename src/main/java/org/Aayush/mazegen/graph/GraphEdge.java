package org.Aayush.mazegen.graph;

/**
 * Undirected weighted corridor between two nodes. The lower id is always stored
 * as {@code startId}.
 *
 * @param startId lower node id.
 * @param endId higher node id.
 * @param weight sum of cell weights walked from {@code startId} to {@code endId}.
 */
public record GraphEdge(int startId, int endId, int weight) {

    public GraphEdge {
        if (startId < 0) {
            throw new IllegalArgumentException("startId must be non-negative, got " + startId);
        }
        if (startId >= endId) {
            throw new IllegalArgumentException(
                    "startId must be lower than endId, got " + startId + " -> " + endId);
        }
    }

    /**
     * Creates an edge between two distinct nodes in either order.
     */
    public static GraphEdge between(int a, int b, int weight) {
        return a < b ? new GraphEdge(a, b, weight) : new GraphEdge(b, a, weight);
    }

    /**
     * @return true when {@code nodeId} is one of the endpoints.
     */
    public boolean touches(int nodeId) {
        return startId == nodeId || endId == nodeId;
    }

    /**
     * Packs the unordered endpoint pair into a single key.
     */
    public long pairKey() {
        return pairKey(startId, endId);
    }

    static long pairKey(int lowerId, int higherId) {
        return ((long) lowerId << 32) | (higherId & 0xFFFFFFFFL);
    }
}
