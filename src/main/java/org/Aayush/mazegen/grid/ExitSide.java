package org.Aayush.mazegen.grid;

import java.util.Objects;
import java.util.Random;

/**
 * Border side that receives the maze exit.
 *
 * <p>{@code RANDOM} is resolved to one of the four concrete sides at generation time.</p>
 */
public enum ExitSide {
    LEFT,
    RIGHT,
    TOP,
    BOTTOM,
    RANDOM;

    private static final ExitSide[] CONCRETE = {LEFT, RIGHT, TOP, BOTTOM};

    /**
     * Resolves {@code RANDOM} uniformly among the concrete sides; concrete sides resolve to themselves.
     *
     * @param random random source used only for {@code RANDOM}.
     * @return a concrete side.
     */
    public ExitSide resolve(Random random) {
        if (this != RANDOM) {
            return this;
        }
        Objects.requireNonNull(random, "random");
        return CONCRETE[random.nextInt(CONCRETE.length)];
    }

    /**
     * Border cell of the exit for a grid of the given size. The exit sits on the middle
     * row (left/right) or the middle column (top/bottom).
     *
     * @throws IllegalStateException when called on {@code RANDOM}.
     */
    public Position exitPosition(int width, int height) {
        return switch (this) {
            case LEFT -> new Position(0, height / 2);
            case RIGHT -> new Position(width - 1, height / 2);
            case TOP -> new Position(width / 2, 0);
            case BOTTOM -> new Position(width / 2, height - 1);
            case RANDOM -> throw new IllegalStateException("RANDOM exit side must be resolved first");
        };
    }
}
