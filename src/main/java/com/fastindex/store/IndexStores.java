package com.fastindex.store;

import com.fastindex.config.IndexConfig;

import java.util.Comparator;
import java.util.List;
import java.util.function.Function;
import java.util.function.ToIntFunction;

/**
 * 存储构建入口。
 *
 * 调用方持有记录列表与存储，并保证在存储及其派生的检索器、视图存活期间不重排、不删除记录。
 * 键提取函数只在构建时使用，存储本身只保存位置。
 */
public final class IndexStores {

    private IndexStores() {
        // 工具类，禁止实例化
    }

    /**
     * 使用哈希存储为记录建立索引，最小/最大键按自然顺序维护。
     */
    public static <R, K extends Comparable<? super K>> IndexStore<K> buildIndex(
            List<? extends R> records, Function<? super R, ? extends K> keyOf) {
        return HashStore.build(records, keyOf);
    }

    public static <R, K> IndexStore<K> hash(
            List<? extends R> records, Function<? super R, ? extends K> keyOf, Comparator<? super K> keyOrder) {
        return HashStore.build(records, keyOf, keyOrder);
    }

    public static <R> IndexStore<Integer> dense(List<? extends R> records, ToIntFunction<? super R> keyOf) {
        return DenseIntStore.build(records, keyOf);
    }

    public static <R> IndexStore<Integer> dense(
            List<? extends R> records, ToIntFunction<? super R> keyOf, IndexConfig config) {
        return DenseIntStore.build(records, keyOf, config);
    }

    public static <R> IndexStore<Integer> signedDense(List<? extends R> records, ToIntFunction<? super R> keyOf) {
        return SignedDenseStore.build(records, keyOf);
    }

    public static <R> IndexStore<Integer> signedDense(
            List<? extends R> records, ToIntFunction<? super R> keyOf, IndexConfig config) {
        return SignedDenseStore.build(records, keyOf, config);
    }

    /**
     * 按存储类型构建整数键索引。
     *
     * @param kind 存储类型
     * @param records 只读有序记录
     * @param keyOf 键提取函数
     * @param config 稠密存储的范围配置，哈希存储忽略
     * @return 构建完成的存储
     */
    public static <R> IndexStore<Integer> intIndex(
            StoreKind kind, List<? extends R> records, ToIntFunction<? super R> keyOf, IndexConfig config) {
        return switch (kind) {
            case DENSE -> DenseIntStore.build(records, keyOf, config);
            case SIGNED_DENSE -> SignedDenseStore.build(records, keyOf, config);
            case HASH -> HashStore.<R, Integer>build(records, record -> keyOf.applyAsInt(record));
        };
    }
}
