package com.fastindex.view;

import com.fastindex.query.Filter;
import com.fastindex.query.RecordQuery;
import com.fastindex.query.RecordSequence;
import com.fastindex.store.KeyLookup;
import com.fastindex.store.PositionList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 索引视图：只暴露调用方选定的键，类似数据库视图。
 *
 * 视图按引用共享父级的位置数据，不复制也不重建索引结构，只持有可见键集合。
 * 可见键之外的键表现为不存在，即使父级中存在。同一存储上可同时存在多个视图。
 *
 * @param <R> 记录类型
 * @param <K> 键类型
 */
public final class IndexView<R, K> implements KeyLookup<K> {
    private static final Logger logger = LoggerFactory.getLogger(IndexView.class);

    private final KeyLookup<K> parent;
    private final Set<K> visibleKeys;
    private final List<? extends R> records;
    private final RecordQuery<R, K> query;

    public IndexView(KeyLookup<K> parent, Collection<? extends K> keys, List<? extends R> records) {
        if (parent == null || keys == null || records == null) {
            throw new IllegalArgumentException("parent、keys与records不能为null");
        }
        Set<K> copied = new HashSet<>(keys);
        if (copied.contains(null)) {
            throw new IllegalArgumentException("视图键不能包含null");
        }
        this.parent = parent;
        this.visibleKeys = Collections.unmodifiableSet(copied);
        this.records = records;
        this.query = new RecordQuery<>(this, records);
        logger.debug("创建索引视图: visibleKeys={}", visibleKeys.size());
    }

    /**
     * 键在可见集合内且父级中存在时返回 true。
     */
    @Override
    public boolean contains(K key) {
        return key != null && visibleKeys.contains(key) && parent.contains(key);
    }

    @Override
    public PositionList positionsFor(K key) {
        if (key == null || !visibleKeys.contains(key)) {
            return PositionList.EMPTY;
        }
        return parent.positionsFor(key);
    }

    public RecordSequence<R> get(K key) {
        return query.get(key);
    }

    /**
     * 依次拼接每个可见键的命中记录，不可见的键被跳过。
     */
    public RecordSequence<R> getMany(Collection<? extends K> keys) {
        return query.getMany(keys);
    }

    public RecordSequence<R> filter(Filter<K> filter) {
        return query.filter(filter);
    }

    public PositionList positions(Filter<K> filter) {
        return query.positions(filter);
    }

    public Set<K> visibleKeys() {
        return visibleKeys;
    }

    /**
     * 在当前视图之上再创建视图，有效键为两者可见键的交集。
     */
    public IndexView<R, K> createView(Collection<? extends K> keys) {
        return new IndexView<>(this, keys, records);
    }
}
