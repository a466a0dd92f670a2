package com.fastindex.error;

/**
 * 索引层所有错误的基类。
 *
 * 键不存在不属于错误，查询返回空结果。
 */
public class IndexException extends RuntimeException {

    public IndexException(String message) {
        super(message);
    }

    public IndexException(String message, Throwable cause) {
        super(message, cause);
    }
}
