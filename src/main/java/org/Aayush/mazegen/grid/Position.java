package org.Aayush.mazegen.grid;

/**
 * Immutable grid coordinate. {@code x} grows to the right, {@code y} grows downward.
 */
public record Position(int x, int y) {
}
