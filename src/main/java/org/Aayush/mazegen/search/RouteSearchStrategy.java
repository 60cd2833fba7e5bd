package org.Aayush.mazegen.search;

/**
 * Work-list discipline used by {@link RouteSearch}.
 *
 * <p>{@code DEPTH_FIRST} pops the most recently pushed cell (connectivity search, any route).</p>
 * <p>{@code BREADTH_FIRST} pops the oldest cell and yields a route with the fewest cells
 * from the seed set.</p>
 */
public enum RouteSearchStrategy {
    DEPTH_FIRST,
    BREADTH_FIRST
}
