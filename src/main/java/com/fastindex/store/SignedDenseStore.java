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
 * 有符号整数键的稠密存储。
 *
 * 非负键与负数键分别存放在两个数组中，负数键 {@code k} 占用槽位 {@code -k - 1}。
 * 范围限制作用于键的绝对值。
 */
public final class SignedDenseStore implements IndexStore<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(SignedDenseStore.class);

    private final PositionList[] nonNegativeSlots;
    private final PositionList[] negativeSlots;
    private final int keyCount;
    private final int positionCount;
    private final KeyMetadata<Integer> metadata;

    private SignedDenseStore(PositionList[] nonNegativeSlots, PositionList[] negativeSlots,
                             int keyCount, int positionCount, KeyMetadata<Integer> metadata) {
        this.nonNegativeSlots = nonNegativeSlots;
        this.negativeSlots = negativeSlots;
        this.keyCount = keyCount;
        this.positionCount = positionCount;
        this.metadata = metadata;
    }

    public static <R> SignedDenseStore build(List<? extends R> records, ToIntFunction<? super R> keyOf) {
        return build(records, keyOf, IndexConfig.defaults());
    }

    /**
     * 单次遍历构建有符号稠密存储。
     *
     * @throws RangeOverflowException 键的绝对值超出允许范围时抛出
     */
    public static <R> SignedDenseStore build(List<? extends R> records, ToIntFunction<? super R> keyOf, IndexConfig config) {
        if (records == null || keyOf == null || config == null) {
            throw new IllegalArgumentException("records、keyOf与config不能为null");
        }
        config.validate();
        int recordCount = records.size();
        long limit = config.denseKeyLimit(recordCount);
        DenseSlots nonNegative = new DenseSlots();
        DenseSlots negative = new DenseSlots();
        KeyMetadata<Integer> metadata = new KeyMetadata<>(Comparator.naturalOrder());

        int position = 0;
        for (R record : records) {
            int key = keyOf.applyAsInt(record);
            long magnitude = Math.abs((long) key);
            if (magnitude >= limit) {
                logger.warn("有符号稠密存储构建失败，键超出范围: position={}, key={}, limit={}", position, key, limit);
                throw new RangeOverflowException(DenseIntStore.overflowReason(magnitude, config), key, limit, position);
            }
            if (key >= 0) {
                nonNegative.add(key, position);
            } else {
                negative.add(-key - 1, position);
            }
            metadata.observe(key);
            position++;
        }

        int keyCount = nonNegative.occupied() + negative.occupied();
        SignedDenseStore store = new SignedDenseStore(nonNegative.freeze(), negative.freeze(), keyCount, recordCount, metadata);
        logger.debug("有符号稠密存储构建完成: keys={}, positions={}, {}", keyCount, recordCount, metadata);
        return store;
    }

    @Override
    public StoreKind kind() {
        return StoreKind.SIGNED_DENSE;
    }

    @Override
    public boolean contains(Integer key) {
        return !positionsFor(key).isEmpty();
    }

    @Override
    public PositionList positionsFor(Integer key) {
        if (key == null) {
            return PositionList.EMPTY;
        }
        if (key >= 0) {
            return DenseSlots.lookup(nonNegativeSlots, key);
        }
        return DenseSlots.lookup(negativeSlots, -(long) key - 1);
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
        for (int slot = negativeSlots.length - 1; slot >= 0; slot--) {
            if (negativeSlots[slot] != null) {
                keys.add(-slot - 1);
            }
        }
        for (int slot = 0; slot < nonNegativeSlots.length; slot++) {
            if (nonNegativeSlots[slot] != null) {
                keys.add(slot);
            }
        }
        return Collections.unmodifiableSet(keys);
    }
}
