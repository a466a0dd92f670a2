package com.fastindex.error;

/**
 * 位置越出底层集合边界，或底层集合大小与存储不一致，说明存储构建有误或集合在存储存活期间被修改。
 */
public class InvariantViolationException extends IndexException {
    /** 错误不对应具体位置时的取值 */
    public static final int NO_POSITION = -1;

    private final int position;
    private final int collectionSize;
    private final int expectedSize;

    public InvariantViolationException(String message, int position, int collectionSize) {
        this(message + ": position=" + position + ", size=" + collectionSize, position, collectionSize, collectionSize);
    }

    private InvariantViolationException(String fullMessage, int position, int collectionSize, int expectedSize) {
        super(fullMessage);
        this.position = position;
        this.collectionSize = collectionSize;
        this.expectedSize = expectedSize;
    }

    /**
     * 存储记录数与底层集合大小不一致。
     *
     * @param expectedSize 构建存储时的记录数
     * @param collectionSize 当前集合大小
     */
    public static InvariantViolationException sizeMismatch(int expectedSize, int collectionSize) {
        return new InvariantViolationException(
            "底层集合大小与存储不一致: expected=" + expectedSize + ", size=" + collectionSize,
            NO_POSITION, collectionSize, expectedSize);
    }

    /**
     * 越界的位置，大小不一致时为 {@link #NO_POSITION}。
     */
    public int getPosition() {
        return position;
    }

    public int getCollectionSize() {
        return collectionSize;
    }

    /**
     * 存储期望的集合大小。
     */
    public int getExpectedSize() {
        return expectedSize;
    }
}
