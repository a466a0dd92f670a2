package com.fastindex.store;

import com.fastindex.config.Constants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * 基于哈希表的存储，适用于任意可哈希的键，查找期望 O(1)。
 *
 * <pre>
 * 记录键: ["Jasmin", "Mario", "Jasmin"]
 *
 *  Key      | Positions
 * ----------------------
 *  "Jasmin" |  0, 2
 *  "Mario"  |  1
 * </pre>
 *
 * 键之间没有顺序保证，最小/最大键由构建时提供的比较器维护。
 *
 * @param <K> 键类型
 */
public final class HashStore<K> implements IndexStore<K> {
    private static final Logger logger = LoggerFactory.getLogger(HashStore.class);

    private final Map<K, PositionList> entries;
    private final int positionCount;
    private final KeyMetadata<K> metadata;

    private HashStore(Map<K, PositionList> entries, int positionCount, KeyMetadata<K> metadata) {
        this.entries = entries;
        this.positionCount = positionCount;
        this.metadata = metadata;
    }

    /**
     * 使用键的自然顺序维护最小/最大键。
     */
    public static <R, K extends Comparable<? super K>> HashStore<K> build(
            List<? extends R> records, Function<? super R, ? extends K> keyOf) {
        return build(records, keyOf, Comparator.naturalOrder());
    }

    /**
     * 单次遍历构建哈希存储。
     *
     * @param records 只读有序记录
     * @param keyOf 键提取函数，不能返回 null
     * @param keyOrder 用于最小/最大键的比较器
     * @return 构建完成的存储
     */
    public static <R, K> HashStore<K> build(
            List<? extends R> records, Function<? super R, ? extends K> keyOf, Comparator<? super K> keyOrder) {
        if (records == null || keyOf == null || keyOrder == null) {
            throw new IllegalArgumentException("records、keyOf与keyOrder不能为null");
        }
        int recordCount = records.size();
        Map<K, PositionList.Builder> builders = new HashMap<>();
        KeyMetadata<K> metadata = new KeyMetadata<>(keyOrder);

        int position = 0;
        for (R record : records) {
            K key = keyOf.apply(record);
            if (key == null) {
                throw new IllegalArgumentException("键提取函数返回null, position=" + position);
            }
            builders.computeIfAbsent(key, ignored -> new PositionList.Builder()).add(position);
            metadata.observe(key);
            position++;
        }

        Map<K, PositionList> entries = new HashMap<>((int) (builders.size() / Constants.HASH_LOAD_FACTOR) + 1);
        for (Map.Entry<K, PositionList.Builder> entry : builders.entrySet()) {
            entries.put(entry.getKey(), entry.getValue().build());
        }
        logger.debug("哈希存储构建完成: keys={}, positions={}, {}", entries.size(), recordCount, metadata);
        return new HashStore<>(entries, recordCount, metadata);
    }

    @Override
    public StoreKind kind() {
        return StoreKind.HASH;
    }

    @Override
    public boolean contains(K key) {
        return key != null && entries.containsKey(key);
    }

    @Override
    public PositionList positionsFor(K key) {
        if (key == null) {
            return PositionList.EMPTY;
        }
        return entries.getOrDefault(key, PositionList.EMPTY);
    }

    @Override
    public KeyMetadata<K> metadata() {
        return metadata;
    }

    @Override
    public int keyCount() {
        return entries.size();
    }

    @Override
    public int positionCount() {
        return positionCount;
    }

    @Override
    public Set<K> keys() {
        return Collections.unmodifiableSet(entries.keySet());
    }
}
