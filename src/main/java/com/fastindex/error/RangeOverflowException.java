package com.fastindex.error;

/**
 * 稠密存储构建时遇到超出可分配范围的键。
 *
 * 调用方应改用其他存储类型（例如哈希存储），存储不会静默截断。
 */
public class RangeOverflowException extends IndexException {
    private final long key;
    private final long limit;
    private final int position;

    public RangeOverflowException(String message, long key, long limit, int position) {
        super(buildMessage(message, key, limit, position));
        this.key = key;
        this.limit = limit;
        this.position = position;
    }

    public long getKey() {
        return key;
    }

    /**
     * 允许的键上界（不含）。
     */
    public long getLimit() {
        return limit;
    }

    public int getPosition() {
        return position;
    }

    private static String buildMessage(String message, long key, long limit, int position) {
        return message + ": key=" + key + ", limit=" + limit + ", position=" + position;
    }
}
