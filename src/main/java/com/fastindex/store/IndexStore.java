package com.fastindex.store;

import java.util.Optional;
import java.util.Set;

/**
 * 一个键维度的完整索引：键到位置集合的映射，构建一次后只读。
 *
 * 全部位置集合的并集恰好覆盖 {@code [0, positionCount())}，每个位置只出现一次。
 *
 * @param <K> 键类型
 */
public interface IndexStore<K> extends KeyLookup<K> {

    StoreKind kind();

    /**
     * 构建时观察到的最小/最大键。
     */
    KeyMetadata<K> metadata();

    default Optional<K> minKey() {
        return metadata().min();
    }

    default Optional<K> maxKey() {
        return metadata().max();
    }

    /**
     * 返回不同键的数量。
     */
    int keyCount();

    /**
     * 返回构建时底层集合的记录数。
     */
    int positionCount();

    /**
     * 返回全部键的只读集合，顺序不作保证。
     */
    Set<K> keys();
}
