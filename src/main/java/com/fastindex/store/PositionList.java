package com.fastindex.store;

import com.fastindex.config.Constants;

import java.util.Arrays;
import java.util.NoSuchElementException;
import java.util.PrimitiveIterator;
import java.util.stream.IntStream;

/**
 * 只读位置列表，按位置严格递增且不含重复。
 *
 * 同时用作单个键的位置集合与过滤表达式的结果集合。
 */
public final class PositionList implements Iterable<Integer> {
    public static final PositionList EMPTY = new PositionList(new int[0], 0);

    private final int[] positions;
    private final int size;

    private PositionList(int[] positions, int size) {
        this.positions = positions;
        this.size = size;
    }

    /**
     * 从任意位置数组创建列表，排序并去重，不修改输入。
     *
     * @param positions 非负位置
     * @return 位置列表
     */
    public static PositionList of(int... positions) {
        if (positions == null) {
            throw new IllegalArgumentException("positions不能为null");
        }
        if (positions.length == 0) {
            return EMPTY;
        }
        int[] sorted = Arrays.copyOf(positions, positions.length);
        Arrays.sort(sorted);
        if (sorted[0] < 0) {
            throw new IllegalArgumentException("位置不能为负数: " + sorted[0]);
        }
        int size = 1;
        for (int index = 1; index < sorted.length; index++) {
            if (sorted[index] != sorted[size - 1]) {
                sorted[size++] = sorted[index];
            }
        }
        return new PositionList(sorted, size);
    }

    /**
     * 返回位置数量。
     *
     * @return 位置数量
     */
    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * 获取指定下标的位置。
     *
     * @param index 下标
     * @return 位置
     */
    public int get(int index) {
        if (index < 0 || index >= size) {
            throw new IndexOutOfBoundsException("下标越界: " + index + ", size=" + size);
        }
        return positions[index];
    }

    public boolean containsPosition(int position) {
        return Arrays.binarySearch(positions, 0, size, position) >= 0;
    }

    public int[] toArray() {
        return Arrays.copyOf(positions, size);
    }

    public IntStream stream() {
        return Arrays.stream(positions, 0, size);
    }

    @Override
    public PrimitiveIterator.OfInt iterator() {
        return new PrimitiveIterator.OfInt() {
            private int cursor;

            @Override
            public boolean hasNext() {
                return cursor < size;
            }

            @Override
            public int nextInt() {
                if (cursor >= size) {
                    throw new NoSuchElementException();
                }
                return positions[cursor++];
            }
        };
    }

    /**
     * 有序归并求并集，用于 OR。
     *
     * @param left 左侧列表
     * @param right 右侧列表
     * @return 递增去重的并集
     */
    public static PositionList union(PositionList left, PositionList right) {
        if (left.isEmpty()) {
            return right;
        }
        if (right.isEmpty()) {
            return left;
        }
        int[] merged = new int[left.size + right.size];
        int leftIndex = 0;
        int rightIndex = 0;
        int count = 0;
        while (leftIndex < left.size && rightIndex < right.size) {
            int leftValue = left.positions[leftIndex];
            int rightValue = right.positions[rightIndex];
            if (leftValue == rightValue) {
                merged[count++] = leftValue;
                leftIndex++;
                rightIndex++;
            } else if (leftValue < rightValue) {
                merged[count++] = leftValue;
                leftIndex++;
            } else {
                merged[count++] = rightValue;
                rightIndex++;
            }
        }
        while (leftIndex < left.size) {
            merged[count++] = left.positions[leftIndex++];
        }
        while (rightIndex < right.size) {
            merged[count++] = right.positions[rightIndex++];
        }
        return new PositionList(merged, count);
    }

    /**
     * 有序归并求交集，用于 AND。
     *
     * @param left 左侧列表
     * @param right 右侧列表
     * @return 递增去重的交集
     */
    public static PositionList intersection(PositionList left, PositionList right) {
        if (left.isEmpty() || right.isEmpty()) {
            return EMPTY;
        }
        int[] common = new int[Math.min(left.size, right.size)];
        int leftIndex = 0;
        int rightIndex = 0;
        int count = 0;
        while (leftIndex < left.size && rightIndex < right.size) {
            int leftValue = left.positions[leftIndex];
            int rightValue = right.positions[rightIndex];
            if (leftValue == rightValue) {
                common[count++] = leftValue;
                leftIndex++;
                rightIndex++;
            } else if (leftValue < rightValue) {
                leftIndex++;
            } else {
                rightIndex++;
            }
        }
        return count == 0 ? EMPTY : new PositionList(common, count);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof PositionList that)) {
            return false;
        }
        return Arrays.equals(positions, 0, size, that.positions, 0, that.size);
    }

    @Override
    public int hashCode() {
        int result = 1;
        for (int index = 0; index < size; index++) {
            result = 31 * result + positions[index];
        }
        return result;
    }

    @Override
    public String toString() {
        return Arrays.toString(toArray());
    }

    /**
     * 构建期使用的追加器，位置必须按集合顺序严格递增地追加。
     */
    public static final class Builder {
        private int[] buffer = new int[Constants.POSITION_LIST_INITIAL_CAPACITY];
        private int count;

        public Builder add(int position) {
            if (position < 0) {
                throw new IllegalArgumentException("位置不能为负数: " + position);
            }
            if (count > 0 && position <= buffer[count - 1]) {
                throw new IllegalArgumentException("位置必须严格递增, current=" + position + ", last=" + buffer[count - 1]);
            }
            if (count == buffer.length) {
                buffer = Arrays.copyOf(buffer, buffer.length * 2);
            }
            buffer[count++] = position;
            return this;
        }

        public int size() {
            return count;
        }

        /**
         * 冻结为只读列表，之后 Builder 不应再被使用。
         */
        public PositionList build() {
            if (count == 0) {
                return EMPTY;
            }
            return new PositionList(count == buffer.length ? buffer : Arrays.copyOf(buffer, count), count);
        }
    }
}
