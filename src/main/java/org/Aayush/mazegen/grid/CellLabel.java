package org.Aayush.mazegen.grid;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.List;

/**
 * Closed set of labels a maze cell can carry.
 *
 * <p>Every label statically carries its traversal weight. Structural labels weigh 0,
 * rewards lower the cost of a corridor and dangers raise it. Weights are only
 * consumed by the graph builder.</p>
 */
@Getter
@Accessors(fluent = true)
public enum CellLabel {
    WALL("Wall", Kind.STRUCTURAL, 0),
    PATH("Path", Kind.STRUCTURAL, 0),
    START("Start", Kind.STRUCTURAL, 0),
    EXIT("Exit", Kind.STRUCTURAL, 0),

    MARSHMALLOWS("Marshmallows", Kind.REWARD, -2),
    GUMMY_BEARS("Gummy Bears", Kind.REWARD, -3),
    COOKIES("Cookies", Kind.REWARD, -4),
    CANDY("Candy", Kind.REWARD, -2),
    CHOCOLATE("Chocolate", Kind.REWARD, -6),

    ZOMBIE("Zombie", Kind.DANGER, 7),
    GHOST("Ghost", Kind.DANGER, 6),
    WITCH("Witch", Kind.DANGER, 9),
    FOG("Fog", Kind.DANGER, 3),
    SHADOWS("Shadows", Kind.DANGER, 4),
    CROW("Crow", Kind.DANGER, 5),
    BLACK_CAT("Black Cat", Kind.DANGER, 2),
    SKELETON("Skeleton", Kind.DANGER, 5),
    SPIDER("Spider", Kind.DANGER, 3),
    BAT("Bat", Kind.DANGER, 1),
    PUMPKIN("Pumpkin", Kind.DANGER, 2);

    /**
     * Partition of the label set.
     */
    public enum Kind {
        STRUCTURAL,
        REWARD,
        DANGER
    }

    private static final List<CellLabel> REWARDS =
            List.of(MARSHMALLOWS, GUMMY_BEARS, COOKIES, CANDY, CHOCOLATE);
    private static final List<CellLabel> DANGERS =
            List.of(ZOMBIE, GHOST, WITCH, FOG, SHADOWS, CROW, BLACK_CAT, SKELETON, SPIDER, BAT, PUMPKIN);

    private final String displayName;
    private final Kind kind;
    private final int weight;

    CellLabel(String displayName, Kind kind, int weight) {
        this.displayName = displayName;
        this.kind = kind;
        this.weight = weight;
    }

    /**
     * @return true for every label except {@link #WALL}.
     */
    public boolean isTraversable() {
        return this != WALL;
    }

    public boolean isReward() {
        return kind == Kind.REWARD;
    }

    public boolean isDanger() {
        return kind == Kind.DANGER;
    }

    /**
     * @return true for reward and danger labels.
     */
    public boolean isArtifact() {
        return kind != Kind.STRUCTURAL;
    }

    /**
     * Reward variants in declaration order.
     */
    public static List<CellLabel> rewards() {
        return REWARDS;
    }

    /**
     * Danger variants in declaration order.
     */
    public static List<CellLabel> dangers() {
        return DANGERS;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
