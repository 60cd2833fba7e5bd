package org.Aayush.mazegen.grid;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("VisitedCells Tests")
class VisitedCellsTest {

    private VisitedCells visited;

    @BeforeEach
    void setUp() {
        visited = new VisitedCells(49);
    }

    @Test
    @DisplayName("Marking and checking visits")
    void testMarkAndCheck() {
        assertFalse(visited.isVisited(24), "Should be unvisited initially");

        assertTrue(visited.markVisited(24), "First markVisited should return true");
        assertTrue(visited.isVisited(24), "Should report true after marking");
        assertFalse(visited.markVisited(24), "Second markVisited should return false");
        assertEquals(1, visited.count());
    }

    @Test
    @DisplayName("Clear resets state")
    void testClear() {
        visited.markVisited(10);
        visited.clear();
        assertFalse(visited.isVisited(10), "Should be unvisited after clear");
        assertEquals(0, visited.count());
    }

    @Test
    @DisplayName("Validation: negative capacity")
    void testNegativeCapacityRejected() {
        assertThrows(IllegalArgumentException.class, () -> new VisitedCells(-1));
    }
}
