package com.fastindex.query;

import com.fastindex.error.InvariantViolationException;
import com.fastindex.store.IndexStore;
import com.fastindex.store.KeyMetadata;
import com.fastindex.store.PositionList;
import com.fastindex.view.IndexView;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * 绑定一个存储与其底层记录集合的查询句柄，二者均为借用。
 *
 * 创建开销很小，可随用随建。只读场景下多个检索器可并发使用同一存储。
 *
 * @param <R> 记录类型
 * @param <K> 键类型
 */
public final class Retriever<R, K> {
    private final IndexStore<K> store;
    private final List<? extends R> records;
    private final RecordQuery<R, K> query;

    /**
     * @param store 基于 {@code records} 构建的存储
     * @param records 构建存储时使用的同一只读集合
     * @throws InvariantViolationException 集合大小与存储记录数不一致时抛出
     */
    public Retriever(IndexStore<K> store, List<? extends R> records) {
        if (store == null || records == null) {
            throw new IllegalArgumentException("store与records不能为null");
        }
        if (store.positionCount() != records.size()) {
            throw InvariantViolationException.sizeMismatch(store.positionCount(), records.size());
        }
        this.store = store;
        this.records = records;
        this.query = new RecordQuery<>(store, records);
    }

    public boolean contains(K key) {
        return query.contains(key);
    }

    /**
     * 返回键对应的位置列表，键不存在时为空。
     */
    public PositionList eq(K key) {
        return query.eq(key);
    }

    /**
     * 按位置顺序返回键对应的记录，键不存在时返回空序列。
     */
    public RecordSequence<R> get(K key) {
        return query.get(key);
    }

    /**
     * 依次拼接每个键的 {@link #get(Object)} 结果。
     *
     * 同一记录可经多个键重复出现，需要集合语义时使用 {@link #filter(Filter)}。
     */
    public RecordSequence<R> getMany(Collection<? extends K> keys) {
        return query.getMany(keys);
    }

    /**
     * 求值过滤表达式并返回按位置升序、无重复的记录。
     *
     * 并集与交集需要物化中间位置集合，这是唯一会分配结果集合的查询。
     */
    public RecordSequence<R> filter(Filter<K> filter) {
        return query.filter(filter);
    }

    public PositionList positions(Filter<K> filter) {
        return query.positions(filter);
    }

    /**
     * 将位置列表解引用为记录，可用于合并同一集合上多个索引的结果。
     */
    public RecordSequence<R> resolve(PositionList positions) {
        return query.resolve(positions);
    }

    public Optional<K> minKey() {
        return store.minKey();
    }

    public Optional<K> maxKey() {
        return store.maxKey();
    }

    public KeyMetadata<K> metadata() {
        return store.metadata();
    }

    public IndexStore<K> store() {
        return store;
    }

    /**
     * 创建只暴露指定键的视图，与本检索器共享底层索引数据。
     */
    public IndexView<R, K> createView(Collection<? extends K> keys) {
        return new IndexView<>(store, keys, records);
    }
}
