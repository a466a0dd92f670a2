package com.fastindex.query;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * 由等值谓词经并集、交集组合而成的过滤表达式树。
 *
 * <pre>
 * Filter.eq(1).or(Filter.eq(2))          // 键1或键2
 * Filter.eq("VW").and(Filter.eq("BMW"))  // 同一索引内通常为空
 * </pre>
 *
 * 求值结果与嵌套方式、求值顺序无关。
 *
 * @param <K> 键类型
 */
public sealed interface Filter<K> permits Filter.Eq, Filter.Or, Filter.And {

    record Eq<K>(K key) implements Filter<K> {
        public Eq {
            Objects.requireNonNull(key, "过滤键不能为null");
        }
    }

    record Or<K>(Filter<K> left, Filter<K> right) implements Filter<K> {
        public Or {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }
    }

    record And<K>(Filter<K> left, Filter<K> right) implements Filter<K> {
        public And {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }
    }

    static <K> Filter<K> eq(K key) {
        return new Eq<>(key);
    }

    default Filter<K> or(Filter<K> other) {
        return new Or<>(this, other);
    }

    default Filter<K> and(Filter<K> other) {
        return new And<>(this, other);
    }

    /**
     * 任一键命中，构造平衡的 Or 树。
     *
     * @param keys 非空键集合
     * @return 过滤表达式
     */
    static <K> Filter<K> anyOf(Collection<? extends K> keys) {
        return balanced(toEqList(keys), true);
    }

    /**
     * 全部键同时命中，构造平衡的 And 树。
     */
    static <K> Filter<K> allOf(Collection<? extends K> keys) {
        return balanced(toEqList(keys), false);
    }

    private static <K> List<Filter<K>> toEqList(Collection<? extends K> keys) {
        if (keys == null || keys.isEmpty()) {
            throw new IllegalArgumentException("键集合不能为空");
        }
        List<Filter<K>> leaves = new ArrayList<>(keys.size());
        for (K key : keys) {
            leaves.add(new Eq<>(key));
        }
        return leaves;
    }

    private static <K> Filter<K> balanced(List<Filter<K>> nodes, boolean union) {
        List<Filter<K>> level = nodes;
        while (level.size() > 1) {
            List<Filter<K>> next = new ArrayList<>((level.size() + 1) / 2);
            for (int index = 0; index + 1 < level.size(); index += 2) {
                Filter<K> left = level.get(index);
                Filter<K> right = level.get(index + 1);
                next.add(union ? new Or<>(left, right) : new And<>(left, right));
            }
            if (level.size() % 2 != 0) {
                next.add(level.get(level.size() - 1));
            }
            level = next;
        }
        return level.get(0);
    }
}
