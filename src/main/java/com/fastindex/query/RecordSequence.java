package com.fastindex.query;

import com.fastindex.error.InvariantViolationException;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.PrimitiveIterator;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Supplier;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * 惰性、有限、可重复遍历的记录序列。
 *
 * 每次 {@link #iterator()} 都从位置来源重新开始，只在取值时按位置解引用记录，
 * 除游标外不额外分配。序列借用存储与底层集合，不应比二者存活更久。
 *
 * @param <R> 记录类型
 */
public final class RecordSequence<R> implements Iterable<R> {
    private final Supplier<? extends PrimitiveIterator.OfInt> positions;
    private final List<? extends R> records;

    RecordSequence(Supplier<? extends PrimitiveIterator.OfInt> positions, List<? extends R> records) {
        this.positions = positions;
        this.records = records;
    }

    @Override
    public Iterator<R> iterator() {
        PrimitiveIterator.OfInt cursor = positions.get();
        return new Iterator<R>() {
            @Override
            public boolean hasNext() {
                return cursor.hasNext();
            }

            @Override
            public R next() {
                if (!cursor.hasNext()) {
                    throw new NoSuchElementException();
                }
                return resolve(records, cursor.nextInt());
            }
        };
    }

    public Stream<R> stream() {
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(iterator(), Spliterator.ORDERED), false);
    }

    public boolean isEmpty() {
        return !positions.get().hasNext();
    }

    /**
     * 遍历并复制为新列表。
     */
    public List<R> toList() {
        List<R> result = new ArrayList<>();
        for (R record : this) {
            result.add(record);
        }
        return result;
    }

    static <R> R resolve(List<? extends R> records, int position) {
        if (position < 0 || position >= records.size()) {
            throw new InvariantViolationException("位置越出底层集合边界", position, records.size());
        }
        return records.get(position);
    }
}
