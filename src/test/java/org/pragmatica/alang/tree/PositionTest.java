package org.pragmatica.alang.tree;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PositionTest {

    @Test
    void span_rendersStartAndEnd() {
        assertEquals("[1,2]-[3,4]", Position.of(1, 2, 3, 4).span());
    }

    @Test
    void zero_isSyntheticEmptySpan() {
        assertEquals("[0,0]-[0,0]", Position.ZERO.span());
    }

    @Test
    void merge_takesEarliestStartAndLatestEnd() {
        var first = Position.of(1, 1, 1, 4);
        var last = Position.of(2, 3, 2, 5);

        assertEquals(Position.of(1, 1, 2, 5), first.merge(last));
        assertEquals(Position.of(1, 1, 2, 5), last.merge(first));
    }

    @Test
    void merge_sameLine_comparesColumns() {
        var inner = Position.of(1, 5, 1, 6);
        var outer = Position.of(1, 1, 1, 10);

        assertEquals(outer, inner.merge(outer));
    }

    @Test
    void contains_checksBothEnds() {
        var outer = Position.of(1, 1, 3, 2);

        assertTrue(outer.contains(Position.of(2, 7, 2, 9)));
        assertTrue(outer.contains(outer));
        assertFalse(outer.contains(Position.of(3, 1, 3, 5)));
    }
}
