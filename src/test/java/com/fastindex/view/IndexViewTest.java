package com.fastindex.view;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fastindex.query.Filter;
import com.fastindex.query.Retriever;
import com.fastindex.store.HashStore;
import com.fastindex.store.IndexStores;
import com.fastindex.store.PositionList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class IndexViewTest {

    record Car(int id, String name) {
    }

    private static final List<Car> CARS = List.of(
        new Car(1, "BMW"),
        new Car(2, "VW"),
        new Car(3, "Audi"),
        new Car(1, "Mini"));

    private final Retriever<Car, Integer> retriever = new Retriever<>(IndexStores.dense(CARS, Car::id), CARS);

    @Test
    @DisplayName("可见键之外的键表现为不存在")
    void testContains() {
        IndexView<Car, Integer> view = retriever.createView(List.of(1, 3));

        assertTrue(view.contains(1));
        assertTrue(view.contains(3));
        assertFalse(view.contains(2));
        assertTrue(retriever.contains(2));
    }

    @Test
    void testVisibleKeyMissingInParent() {
        IndexView<Car, Integer> view = retriever.createView(List.of(1, 42));

        assertFalse(view.contains(42));
        assertTrue(view.get(42).isEmpty());
    }

    @Test
    void testViewContainsImpliesParentContains() {
        IndexView<Car, Integer> view = retriever.createView(List.of(2, 3, 7));

        for (int key = 0; key < 10; key++) {
            if (view.contains(key)) {
                assertTrue(retriever.contains(key), "key=" + key);
            }
        }
    }

    @Test
    void testGet() {
        IndexView<Car, Integer> view = retriever.createView(List.of(1, 3));

        assertEquals(List.of(new Car(1, "BMW"), new Car(1, "Mini")), view.get(1).toList());
        assertTrue(view.get(2).isEmpty());
    }

    @Test
    void testGetManySkipsHiddenKeys() {
        IndexView<Car, Integer> view = retriever.createView(List.of(1, 3));

        assertEquals(List.of(new Car(3, "Audi"), new Car(1, "BMW"), new Car(1, "Mini")),
            view.getMany(List.of(3, 2, 1)).toList());
    }

    @Test
    void testFilter() {
        IndexView<Car, Integer> view = retriever.createView(List.of(1, 3));

        assertEquals(List.of(new Car(1, "BMW"), new Car(3, "Audi"), new Car(1, "Mini")),
            view.filter(Filter.eq(1).or(Filter.eq(2)).or(Filter.eq(3))).toList());
        assertEquals(PositionList.of(2), view.positions(Filter.eq(2).or(Filter.eq(3))));
        assertTrue(view.filter(Filter.eq(2)).isEmpty());
    }

    @Test
    @DisplayName("视图共享父级位置数据而不复制")
    void testSharesParentData() {
        IndexView<Car, Integer> view = retriever.createView(List.of(1));

        assertSame(retriever.eq(1), view.positionsFor(1));
        assertSame(PositionList.EMPTY, view.positionsFor(2));
    }

    @Test
    void testMultipleViewsCoexist() {
        IndexView<Car, Integer> first = retriever.createView(List.of(1));
        IndexView<Car, Integer> second = retriever.createView(List.of(2));

        assertTrue(first.contains(1));
        assertFalse(first.contains(2));
        assertTrue(second.contains(2));
        assertFalse(second.contains(1));
    }

    @Test
    void testNestedView() {
        IndexView<Car, Integer> outer = retriever.createView(List.of(1, 2));
        IndexView<Car, Integer> inner = outer.createView(List.of(2, 3));

        assertTrue(inner.contains(2));
        assertFalse(inner.contains(1));
        assertFalse(inner.contains(3));
        assertEquals(List.of(new Car(2, "VW")), inner.filter(Filter.anyOf(List.of(1, 2, 3))).toList());
    }

    @Test
    void testHashStoreView() {
        HashStore<String> names = HashStore.build(CARS, Car::name);
        IndexView<Car, String> view = new IndexView<>(names, Set.of("VW", "Audi"), CARS);

        assertTrue(view.contains("VW"));
        assertFalse(view.contains("BMW"));
        assertFalse(view.contains(null));
        assertEquals(Set.of("VW", "Audi"), view.visibleKeys());
    }

    @Test
    void testRejectInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> retriever.createView(null));
        assertThrows(IllegalArgumentException.class, () -> retriever.createView(Arrays.asList(1, null)));
    }
}
