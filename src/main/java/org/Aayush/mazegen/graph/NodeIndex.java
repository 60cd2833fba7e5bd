package org.Aayush.mazegen.graph;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import lombok.experimental.StandardException;
import org.Aayush.mazegen.grid.Position;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable bidirectional mapping between graph-significant grid positions and dense
 * node ids {@code 0..size-1}.
 * <p>
 * Ids follow the order of the list handed to the constructor.
 * Safe for concurrent reads once built.
 * </p>
 */
public final class NodeIndex {

    private static final NodeIndex EMPTY = new NodeIndex(List.of());

    // Position -> id (forward lookup)
    private final Object2IntOpenHashMap<Position> forward;
    // id -> Position (reverse lookup)
    private final Position[] reverse;

    /**
     * Builds the index from positions in id order.
     *
     * @param positionsInIdOrder node positions; the element at index {@code i} gets id {@code i}.
     * @throws IllegalArgumentException on null or duplicate positions.
     */
    public NodeIndex(List<Position> positionsInIdOrder) {
        if (positionsInIdOrder == null) {
            throw new IllegalArgumentException("positions cannot be null");
        }
        int size = positionsInIdOrder.size();
        this.forward = new Object2IntOpenHashMap<>(size);
        this.forward.defaultReturnValue(-1);
        this.reverse = new Position[size];

        for (int id = 0; id < size; id++) {
            Position position = positionsInIdOrder.get(id);
            if (position == null) {
                throw new IllegalArgumentException("Null position at node id " + id);
            }
            if (forward.containsKey(position)) {
                throw new IllegalArgumentException("Duplicate node position detected: " + position);
            }
            forward.put(position, id);
            reverse[id] = position;
        }
        this.forward.trim();
    }

    public static NodeIndex empty() {
        return EMPTY;
    }

    /**
     * @throws UnknownNodeException if {@code position} is not a node.
     */
    public int toId(Position position) {
        int id = forward.getInt(position);
        if (id == -1) {
            throw new UnknownNodeException("Position is not a graph node: " + position);
        }
        return id;
    }

    /**
     * @return node id, or {@code -1} when {@code position} is not a node.
     */
    public int idOrNegative(Position position) {
        return forward.getInt(position);
    }

    /**
     * @throws IndexOutOfBoundsException if the id is outside {@code [0, size)}.
     */
    public Position toPosition(int id) {
        if (!containsId(id)) {
            throw new IndexOutOfBoundsException("Node id out of bounds: " + id);
        }
        return reverse[id];
    }

    public boolean contains(Position position) {
        return position != null && forward.containsKey(position);
    }

    public boolean containsId(int id) {
        return id >= 0 && id < reverse.length;
    }

    public int size() {
        return reverse.length;
    }

    /**
     * @return positions in id order.
     */
    public List<Position> positions() {
        return List.of(reverse);
    }

    /**
     * @return insertion-ordered, unmodifiable position-to-id view.
     */
    public Map<Position, Integer> asMap() {
        Map<Position, Integer> map = new LinkedHashMap<>(reverse.length * 2);
        for (int id = 0; id < reverse.length; id++) {
            map.put(reverse[id], id);
        }
        return Collections.unmodifiableMap(map);
    }

    /**
     * Thrown when a position has no node id.
     */
    @StandardException
    public static class UnknownNodeException extends RuntimeException {
    }
}
