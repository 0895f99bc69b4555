package org.terrain.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GridTest {

    @Test
    void newGridIsEmptyUntilEveryCellIsSet() {
        Grid<String> g = new Grid<>(2);
        assertEquals(4, g.size());
        assertNull(g.get(1, 1));
        assertFalse(g.isComplete());
        g.fill("a");
        g.set(1, 0, "b");
        assertTrue(g.isComplete());
        assertEquals("b", g.get(1));
        assertEquals(3, g.count("a"));
    }

    @Test
    void copyIsIndependentAndEqual() {
        Grid<Integer> g = Grid.filled(3, 1);
        g.freeze();
        Grid<Integer> c = g.copy();
        assertEquals(g, c);
        assertEquals(g.hashCode(), c.hashCode());
        assertFalse(c.isFrozen());
        c.set(2, 2, 5);
        assertNotEquals(g, c);
        assertEquals(1, g.get(2, 2));
    }

    @Test
    void frozenGridRejectsWrites() {
        Grid<Integer> g = Grid.filled(2, 0).freeze();
        assertThrows(IllegalStateException.class, () -> g.set(0, 0, 1));
        assertThrows(IllegalStateException.class, () -> g.fill(1));
    }

    @Test
    void outOfBoundsAccessFails() {
        Grid<Integer> g = Grid.filled(2, 0);
        assertFalse(g.inBounds(2, 0));
        assertThrows(IndexOutOfBoundsException.class, () -> g.get(-1, 0));
        assertThrows(IllegalArgumentException.class, () -> new Grid<Integer>(0));
    }
}
