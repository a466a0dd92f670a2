package com.fastindex.store;

/** 存储实现类型 */
public enum StoreKind {
    /** 基于数组的无符号整数键存储 */
    DENSE,
    /** 基于数组的有符号整数键存储 */
    SIGNED_DENSE,
    /** 基于哈希表的任意键存储 */
    HASH
}
