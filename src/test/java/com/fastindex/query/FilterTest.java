package com.fastindex.query;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;

class FilterTest {

    @Test
    void testFluentComposition() {
        Filter<Integer> filter = Filter.eq(1).or(Filter.eq(2)).and(Filter.eq(3));

        Filter.And<Integer> and = assertInstanceOf(Filter.And.class, filter);
        Filter.Or<Integer> or = assertInstanceOf(Filter.Or.class, and.left());
        assertEquals(new Filter.Eq<>(1), or.left());
        assertEquals(new Filter.Eq<>(2), or.right());
        assertEquals(new Filter.Eq<>(3), and.right());
    }

    @Test
    void testAnyOfBuildsBalancedTree() {
        Filter<Integer> filter = Filter.anyOf(List.of(1, 2, 3, 4));

        assertEquals(
            new Filter.Or<>(new Filter.Or<>(Filter.eq(1), Filter.eq(2)), new Filter.Or<>(Filter.eq(3), Filter.eq(4))),
            filter);
    }

    @Test
    void testAnyOfOddCount() {
        Filter<String> filter = Filter.anyOf(List.of("a", "b", "c"));

        assertEquals(new Filter.Or<>(new Filter.Or<>(Filter.eq("a"), Filter.eq("b")), Filter.eq("c")), filter);
    }

    @Test
    void testSingleKey() {
        assertEquals(Filter.eq("a"), Filter.allOf(List.of("a")));
        assertEquals(Filter.eq("a"), Filter.anyOf(List.of("a")));
    }

    @Test
    void testRejectEmptyAndNull() {
        assertThrows(IllegalArgumentException.class, () -> Filter.anyOf(List.<Integer>of()));
        assertThrows(IllegalArgumentException.class, () -> Filter.allOf(null));
        assertThrows(NullPointerException.class, () -> Filter.eq(null));
        assertThrows(NullPointerException.class, () -> Filter.eq(1).or(null));
    }
}
