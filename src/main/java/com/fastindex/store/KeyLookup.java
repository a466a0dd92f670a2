package com.fastindex.store;

/**
 * 键到位置集合的只读查找能力。
 *
 * 存储与视图都实现该接口，查询层只面向它编写。
 *
 * @param <K> 键类型
 */
public interface KeyLookup<K> {

    /**
     * 判断键是否存在，等价于 {@code !positionsFor(key).isEmpty()}。
     */
    boolean contains(K key);

    /**
     * 返回键对应的递增位置列表，键不存在时返回 {@link PositionList#EMPTY}。
     */
    PositionList positionsFor(K key);
}
