package com.fastindex.query;

import com.fastindex.store.KeyLookup;
import com.fastindex.store.PositionList;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.PrimitiveIterator;

/**
 * 面向 {@link KeyLookup} 的通用查询执行器，检索器与视图共用。
 *
 * @param <R> 记录类型
 * @param <K> 键类型
 */
public final class RecordQuery<R, K> {
    private final KeyLookup<K> lookup;
    private final List<? extends R> records;

    public RecordQuery(KeyLookup<K> lookup, List<? extends R> records) {
        if (lookup == null || records == null) {
            throw new IllegalArgumentException("lookup与records不能为null");
        }
        this.lookup = lookup;
        this.records = records;
    }

    public boolean contains(K key) {
        return lookup.contains(key);
    }

    public PositionList eq(K key) {
        return lookup.positionsFor(key);
    }

    public RecordSequence<R> get(K key) {
        PositionList positions = lookup.positionsFor(key);
        return new RecordSequence<>(positions::iterator, records);
    }

    /**
     * 按给定键顺序依次拼接各键的命中记录，不去重。
     */
    public RecordSequence<R> getMany(Collection<? extends K> keys) {
        if (keys == null) {
            throw new IllegalArgumentException("keys不能为null");
        }
        List<K> orderedKeys = new ArrayList<>(keys);
        return new RecordSequence<>(() -> new ConcatCursor<>(lookup, orderedKeys.iterator()), records);
    }

    /**
     * 求值过滤表达式，结果按位置升序且无重复。
     */
    public RecordSequence<R> filter(Filter<K> filter) {
        return resolve(positions(filter));
    }

    public PositionList positions(Filter<K> filter) {
        return FilterEvaluator.evaluate(filter, lookup);
    }

    public RecordSequence<R> resolve(PositionList positions) {
        if (positions == null) {
            throw new IllegalArgumentException("positions不能为null");
        }
        return new RecordSequence<>(positions::iterator, records);
    }

    private static final class ConcatCursor<K> implements PrimitiveIterator.OfInt {
        private final KeyLookup<K> lookup;
        private final Iterator<K> keys;
        private PrimitiveIterator.OfInt current = PositionList.EMPTY.iterator();

        ConcatCursor(KeyLookup<K> lookup, Iterator<K> keys) {
            this.lookup = lookup;
            this.keys = keys;
        }

        @Override
        public boolean hasNext() {
            while (!current.hasNext()) {
                if (!keys.hasNext()) {
                    return false;
                }
                current = lookup.positionsFor(keys.next()).iterator();
            }
            return true;
        }

        @Override
        public int nextInt() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return current.nextInt();
        }
    }
}
