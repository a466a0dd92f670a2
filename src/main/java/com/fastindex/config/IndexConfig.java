package com.fastindex.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;

/**
 * 索引运行时配置
 *
 * 支持从JSON文件注入，覆盖Constants默认值
 */
public class IndexConfig {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
        .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private int denseMaxKey = Constants.DENSE_MAX_KEY;
    private int denseRangeFactor = Constants.DENSE_RANGE_FACTOR;
    private int denseMinRange = Constants.DENSE_MIN_RANGE;

    public int getDenseMaxKey() {
        return denseMaxKey;
    }

    public void setDenseMaxKey(int denseMaxKey) {
        this.denseMaxKey = denseMaxKey;
    }

    public int getDenseRangeFactor() {
        return denseRangeFactor;
    }

    public void setDenseRangeFactor(int denseRangeFactor) {
        this.denseRangeFactor = denseRangeFactor;
    }

    public int getDenseMinRange() {
        return denseMinRange;
    }

    public void setDenseMinRange(int denseMinRange) {
        this.denseMinRange = denseMinRange;
    }

    /**
     * 计算给定记录数下稠密存储允许的键上界（不含）。
     *
     * @param recordCount 记录数
     * @return 键必须严格小于该值
     */
    public long denseKeyLimit(int recordCount) {
        long sparseLimit = Math.max((long) denseMinRange, (long) recordCount * denseRangeFactor);
        return Math.min((long) denseMaxKey + 1, sparseLimit);
    }

    /**
     * 校验配置取值，非法时抛出 IllegalArgumentException。
     *
     * @return 当前实例
     */
    public IndexConfig validate() {
        if (denseMaxKey < 0) {
            throw new IllegalArgumentException("denseMaxKey不能为负数: " + denseMaxKey);
        }
        if (denseRangeFactor <= 0) {
            throw new IllegalArgumentException("denseRangeFactor必须为正数: " + denseRangeFactor);
        }
        if (denseMinRange <= 0) {
            throw new IllegalArgumentException("denseMinRange必须为正数: " + denseMinRange);
        }
        return this;
    }

    /**
     * 使用默认配置创建实例
     */
    public static IndexConfig defaults() {
        return new IndexConfig();
    }

    /**
     * 从指定 JSON 文件读取配置，未出现的字段保持默认值。
     *
     * @param file 配置文件
     * @return 校验后的配置
     * @throws IOException 读取或解析失败时抛出
     */
    public static IndexConfig load(Path file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("配置文件不能为空");
        }
        IndexConfig config;
        try {
            config = OBJECT_MAPPER.readValue(file.toFile(), IndexConfig.class);
        } catch (IOException exception) {
            throw new IOException("读取索引配置失败: " + file.toAbsolutePath(), exception);
        }
        return config.validate();
    }
}
