package org.Aayush.mazegen.grid;

import lombok.experimental.UtilityClass;

/**
 * Dimension normalization rules applied when a {@link Grid} is created.
 *
 * <p>Out-of-range values are rounded, never rejected.</p>
 */
@UtilityClass
public final class GridDimensions {

    /** Smallest width/height that fits a center room plus a carving ring. */
    public static final int MIN_DIMENSION = 7;
    /** Valid dimensions are spaced by this step so the center lands on the carving lattice. */
    public static final int DIMENSION_STEP = 4;

    /**
     * Rounds a requested width or height up to the nearest valid value.
     *
     * @param requested requested dimension (any value, including negatives).
     * @return value {@code >= 7} with {@code (value - 7) % 4 == 0}.
     */
    public static int constrainDimension(int requested) {
        if (requested < MIN_DIMENSION) {
            return MIN_DIMENSION;
        }
        int remainder = (requested - MIN_DIMENSION) % DIMENSION_STEP;
        return remainder == 0 ? requested : requested + (DIMENSION_STEP - remainder);
    }

    /**
     * Clamps a room side so the room never reaches the outer border.
     *
     * @param requested requested room side.
     * @param width normalized grid width.
     * @param height normalized grid height.
     * @return room side in {@code [0, min(width, height) - 2]}.
     */
    public static int constrainRoomSize(int requested, int width, int height) {
        int max = Math.min(width, height) - 2;
        return Math.max(0, Math.min(requested, max));
    }

    /**
     * @return true when {@code dimension} already satisfies the normalization rule.
     */
    public static boolean isValidDimension(int dimension) {
        return dimension >= MIN_DIMENSION && (dimension - MIN_DIMENSION) % DIMENSION_STEP == 0;
    }
}
