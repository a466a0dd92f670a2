package com.fastindex.store;

import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;

/**
 * 存储的最小/最大键摘要，只在构建遍历中更新，查询时不再重新计算。
 *
 * @param <K> 键类型
 */
public final class KeyMetadata<K> {
    private final Comparator<? super K> comparator;
    private K min;
    private K max;

    KeyMetadata(Comparator<? super K> comparator) {
        this.comparator = Objects.requireNonNull(comparator, "comparator");
    }

    void observe(K key) {
        if (min == null || comparator.compare(key, min) < 0) {
            min = key;
        }
        if (max == null || comparator.compare(key, max) > 0) {
            max = key;
        }
    }

    public Optional<K> min() {
        return Optional.ofNullable(min);
    }

    public Optional<K> max() {
        return Optional.ofNullable(max);
    }

    public boolean isEmpty() {
        return min == null;
    }

    @Override
    public String toString() {
        return isEmpty() ? "KeyMetadata[empty]" : "KeyMetadata[min=" + min + ", max=" + max + "]";
    }
}
