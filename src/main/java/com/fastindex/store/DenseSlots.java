package com.fastindex.store;

import java.util.Arrays;

/**
 * 稠密存储构建期的槽位数组，按观察到的最大槽位增长，冻结后交给存储只读使用。
 */
final class DenseSlots {
    private PositionList.Builder[] builders = new PositionList.Builder[16];
    private int length;
    private int occupied;

    void add(int slot, int position) {
        if (slot >= builders.length) {
            int grown = (int) Math.min(Integer.MAX_VALUE - 8L, Math.max((long) slot + 1, builders.length * 2L));
            builders = Arrays.copyOf(builders, grown);
        }
        PositionList.Builder builder = builders[slot];
        if (builder == null) {
            builder = new PositionList.Builder();
            builders[slot] = builder;
            occupied++;
        }
        builder.add(position);
        length = Math.max(length, slot + 1);
    }

    int occupied() {
        return occupied;
    }

    /**
     * 冻结为长度等于最大槽位加一的数组，空槽位为 null。
     */
    PositionList[] freeze() {
        PositionList[] frozen = new PositionList[length];
        for (int slot = 0; slot < length; slot++) {
            if (builders[slot] != null) {
                frozen[slot] = builders[slot].build();
            }
        }
        builders = null;
        return frozen;
    }

    static PositionList lookup(PositionList[] slots, long slot) {
        if (slot < 0 || slot >= slots.length) {
            return PositionList.EMPTY;
        }
        PositionList positions = slots[(int) slot];
        return positions == null ? PositionList.EMPTY : positions;
    }
}
