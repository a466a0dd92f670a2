package com.fastindex.query;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeout;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fastindex.store.HashStore;
import com.fastindex.store.PositionList;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class FilterEvaluatorTest {

    // 位置:              0    1    2    3    4    5    6
    private static final List<String> KEYS = List.of("x", "a", "b", "c", "x", "y", "z");
    private final HashStore<String> store = HashStore.build(KEYS, key -> key);

    @Test
    void testEq() {
        assertEquals(PositionList.of(0, 4), FilterEvaluator.evaluate(Filter.eq("x"), store));
        assertTrue(FilterEvaluator.evaluate(Filter.eq("zz"), store).isEmpty());
    }

    @Test
    void testOr() {
        assertEquals(PositionList.of(0, 1, 4), FilterEvaluator.evaluate(Filter.eq("a").or(Filter.eq("x")), store));
        assertEquals(PositionList.of(1), FilterEvaluator.evaluate(Filter.eq("zz").or(Filter.eq("a")), store));
        assertTrue(FilterEvaluator.evaluate(Filter.eq("zz").or(Filter.eq("xx")), store).isEmpty());
    }

    @Test
    void testOrOfSameKeyDeduplicates() {
        assertEquals(PositionList.of(0, 4), FilterEvaluator.evaluate(Filter.eq("x").or(Filter.eq("x")), store));
    }

    @Test
    void testAnd() {
        assertTrue(FilterEvaluator.evaluate(Filter.eq("a").and(Filter.eq("b")), store).isEmpty());
        assertEquals(PositionList.of(0, 4), FilterEvaluator.evaluate(Filter.eq("x").and(Filter.eq("x")), store));
        Filter<String> mixed = Filter.eq("x").or(Filter.eq("a")).and(Filter.eq("a").or(Filter.eq("c")));
        assertEquals(PositionList.of(1), FilterEvaluator.evaluate(mixed, store));
    }

    @Test
    @DisplayName("结果与嵌套方式和操作数顺序无关")
    void testCommutativeAndAssociative() {
        Filter<String> a = Filter.eq("a");
        Filter<String> x = Filter.eq("x");
        Filter<String> z = Filter.eq("z");

        PositionList expected = PositionList.of(0, 1, 4, 6);
        assertEquals(expected, FilterEvaluator.evaluate(a.or(x).or(z), store));
        assertEquals(expected, FilterEvaluator.evaluate(a.or(x.or(z)), store));
        assertEquals(expected, FilterEvaluator.evaluate(z.or(a).or(x), store));
        assertEquals(expected, FilterEvaluator.evaluate(Filter.anyOf(List.of("z", "x", "a")), store));

        Filter<String> left = a.or(x).and(x.or(z));
        Filter<String> right = x.or(z).and(x.or(a));
        assertEquals(PositionList.of(0, 4), FilterEvaluator.evaluate(left, store));
        assertEquals(FilterEvaluator.evaluate(left, store), FilterEvaluator.evaluate(right, store));
    }

    @Test
    void testRandomExpressionsMatchSetSemantics() {
        Random random = new Random(2024);
        List<String> alphabet = List.of("a", "b", "c", "x", "y", "z", "missing");
        for (int round = 0; round < 200; round++) {
            List<String> left = pick(random, alphabet);
            List<String> right = pick(random, alphabet);
            Filter<String> filter = Filter.anyOf(left).and(Filter.anyOf(right));

            List<Integer> expected = new ArrayList<>();
            for (int position = 0; position < KEYS.size(); position++) {
                String key = KEYS.get(position);
                if (left.contains(key) && right.contains(key)) {
                    expected.add(position);
                }
            }
            PositionList actual = FilterEvaluator.evaluate(filter, store);
            assertEquals(expected, actual.stream().boxed().toList(), filter.toString());
        }
    }

    @Test
    @DisplayName("长链式表达式不会耗尽调用栈")
    void testLongChainDoesNotOverflowStack() {
        Filter<String> chain = Filter.eq("a");
        for (int index = 0; index < 100_000; index++) {
            chain = chain.or(Filter.eq(index % 2 == 0 ? "b" : "missing"));
        }
        Filter<String> conjunction = Filter.eq("x");
        for (int index = 0; index < 100_000; index++) {
            conjunction = conjunction.and(Filter.eq("x"));
        }

        assertEquals(PositionList.of(1, 2), FilterEvaluator.evaluate(chain, store));
        assertEquals(PositionList.of(0, 4), FilterEvaluator.evaluate(conjunction, store));
    }

    @Test
    @DisplayName("宽 anyOf 的并集代价近似线性")
    void testWideUnionStaysNearLinear() {
        int keyCount = 200_000;
        List<Integer> keys = new ArrayList<>(keyCount);
        for (int key = 0; key < keyCount; key++) {
            keys.add(key);
        }
        HashStore<Integer> wide = HashStore.build(keys, key -> key);
        Filter<Integer> filter = Filter.anyOf(keys);

        PositionList positions = assertTimeout(Duration.ofSeconds(5), () -> FilterEvaluator.evaluate(filter, wide));

        assertEquals(keyCount, positions.size());
        assertEquals(0, positions.get(0));
        assertEquals(keyCount - 1, positions.get(keyCount - 1));
    }

    @Test
    void testRejectNullArguments() {
        assertThrows(IllegalArgumentException.class, () -> FilterEvaluator.evaluate(null, store));
        assertThrows(IllegalArgumentException.class, () -> FilterEvaluator.evaluate(Filter.eq("a"), null));
    }

    private static List<String> pick(Random random, List<String> alphabet) {
        List<String> picked = new ArrayList<>();
        for (String key : alphabet) {
            if (random.nextBoolean()) {
                picked.add(key);
            }
        }
        if (picked.isEmpty()) {
            picked.add(alphabet.get(random.nextInt(alphabet.size())));
        }
        return picked;
    }
}
