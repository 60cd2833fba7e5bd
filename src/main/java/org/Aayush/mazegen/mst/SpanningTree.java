package org.Aayush.mazegen.mst;

import lombok.Value;
import org.Aayush.mazegen.graph.GraphEdge;
import org.Aayush.mazegen.graph.NodeIndex;

import java.util.List;

/**
 * Result of a Prim run: the full node index of the source graph plus the chosen edges.
 * When the source graph is disconnected, this is the tree of the center's component only.
 */
@Value
public class SpanningTree {
    NodeIndex nodes;
    /** Chosen edges in selection order. */
    List<GraphEdge> edges;
    long totalWeight;
    /** Nodes reached from the center, the center included. */
    int reachedNodeCount;

    /**
     * @return true when every node of the source graph is connected by the tree.
     */
    public boolean spansAllNodes() {
        return reachedNodeCount == nodes.size();
    }
}
