package com.fastindex.store;

import com.fastindex.config.IndexConfig;
import com.fastindex.error.RangeOverflowException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.ToIntFunction;

/**
 * 无符号整数键的稠密存储，键即数组下标，查找 O(1)。
 *
 * <pre>
 * 记录键: [3, 2, 3, 1]
 *
 *  Key | Positions
 * -----------------
 *  0   |  -
 *  1   |  3
 *  2   |  1
 *  3   |  0, 2
 * </pre>
 *
 * 内存与键范围成正比而非记录数。键范围在构建前由 {@link IndexConfig#denseKeyLimit(int)} 固定，
 * 超出范围的键使构建失败。
 */
public final class DenseIntStore implements IndexStore<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(DenseIntStore.class);

    private final PositionList[] slots;
    private final int keyCount;
    private final int positionCount;
    private final KeyMetadata<Integer> metadata;

    private DenseIntStore(PositionList[] slots, int keyCount, int positionCount, KeyMetadata<Integer> metadata) {
        this.slots = slots;
        this.keyCount = keyCount;
        this.positionCount = positionCount;
        this.metadata = metadata;
    }

    public static <R> DenseIntStore build(List<? extends R> records, ToIntFunction<? super R> keyOf) {
        return build(records, keyOf, IndexConfig.defaults());
    }

    /**
     * 单次遍历构建稠密存储。
     *
     * @param records 只读有序记录
     * @param keyOf 键提取函数
     * @param config 范围配置
     * @return 构建完成的存储
     * @throws RangeOverflowException 键为负数或超出允许范围时抛出
     */
    public static <R> DenseIntStore build(List<? extends R> records, ToIntFunction<? super R> keyOf, IndexConfig config) {
        if (records == null || keyOf == null || config == null) {
            throw new IllegalArgumentException("records、keyOf与config不能为null");
        }
        config.validate();
        int recordCount = records.size();
        long limit = config.denseKeyLimit(recordCount);
        DenseSlots denseSlots = new DenseSlots();
        KeyMetadata<Integer> metadata = new KeyMetadata<>(Comparator.naturalOrder());

        int position = 0;
        for (R record : records) {
            int key = keyOf.applyAsInt(record);
            if (key < 0) {
                logger.warn("稠密存储构建失败，负数键: position={}, key={}", position, key);
                throw new RangeOverflowException("无符号稠密存储不接受负数键", key, limit, position);
            }
            if (key >= limit) {
                logger.warn("稠密存储构建失败，键超出范围: position={}, key={}, limit={}", position, key, limit);
                throw new RangeOverflowException(overflowReason(key, config), key, limit, position);
            }
            denseSlots.add(key, position);
            metadata.observe(key);
            position++;
        }

        DenseIntStore store = new DenseIntStore(denseSlots.freeze(), denseSlots.occupied(), recordCount, metadata);
        logger.debug("稠密存储构建完成: keys={}, positions={}, slots={}, {}",
            store.keyCount, recordCount, store.slots.length, metadata);
        return store;
    }

    static String overflowReason(long magnitude, IndexConfig config) {
        if (magnitude > config.getDenseMaxKey()) {
            return "键超出稠密存储可分配范围";
        }
        return "键范围相对记录数过于稀疏，请改用哈希存储";
    }

    @Override
    public StoreKind kind() {
        return StoreKind.DENSE;
    }

    @Override
    public boolean contains(Integer key) {
        return key != null && !DenseSlots.lookup(slots, key).isEmpty();
    }

    @Override
    public PositionList positionsFor(Integer key) {
        if (key == null) {
            return PositionList.EMPTY;
        }
        return DenseSlots.lookup(slots, key);
    }

    @Override
    public KeyMetadata<Integer> metadata() {
        return metadata;
    }

    @Override
    public int keyCount() {
        return keyCount;
    }

    @Override
    public int positionCount() {
        return positionCount;
    }

    /**
     * 按键升序返回全部键。
     */
    @Override
    public Set<Integer> keys() {
        Set<Integer> keys = new LinkedHashSet<>(keyCount * 2);
        for (int slot = 0; slot < slots.length; slot++) {
            if (slots[slot] != null) {
                keys.add(slot);
            }
        }
        return Collections.unmodifiableSet(keys);
    }

    /**
     * 返回已分配的槽位数，即最大键加一。
     */
    public int slotCount() {
        return slots.length;
    }
}
