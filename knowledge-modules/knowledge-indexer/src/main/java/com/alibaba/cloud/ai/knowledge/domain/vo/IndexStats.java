package com.alibaba.cloud.ai.knowledge.domain.vo;

import lombok.Builder;
import lombok.Value;

/**
 * 索引整体统计: 存储后端 + 切割器配置 + 向量模型
 *
 * @author RobustH
 */
@Value
@Builder
public class IndexStats {

    BackendStats backend;

    ChunkerSettings chunker;

    EmbeddingSettings embedding;

    @Value
    @Builder
    public static class ChunkerSettings {
        int chunkSize;
        int chunkOverlap;
        int minChunkSize;
    }

    @Value
    @Builder
    public static class EmbeddingSettings {
        String model;
        int dimension;
    }
}
