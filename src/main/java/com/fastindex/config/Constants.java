package com.fastindex.config;

/**
 * 全局常量定义
 *
 * 包含稠密存储的范围参数与构建参数
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }

    // ==================== 稠密存储参数 ====================
    /** 稠密存储允许分配的最大键（含），约 1600 万个槽位 */
    public static final int DENSE_MAX_KEY = (1 << 24) - 1;
    /** 键范围与记录数之比的上限，超过视为过度稀疏 */
    public static final int DENSE_RANGE_FACTOR = 64;
    /** 稀疏检查的下限，小集合使用稀疏ID时仍可构建 */
    public static final int DENSE_MIN_RANGE = 1024;

    // ==================== 构建参数 ====================
    /** 位置列表初始容量 */
    public static final int POSITION_LIST_INITIAL_CAPACITY = 4;
    /** 哈希存储负载因子 */
    public static final float HASH_LOAD_FACTOR = 0.75f;
}
