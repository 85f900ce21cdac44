package com.alibaba.cloud.ai.knowledge.domain.vo;

import com.alibaba.cloud.ai.knowledge.exception.KnowledgeValidationException;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.Map;

/**
 * 知识块模型
 * 一个 Source 的有界文本片段，是生成向量的最小单位
 *
 * @author RobustH
 */
@Value
@Builder(toBuilder = true)
public class Chunk {

    @NonNull
    String chunkId;

    /**
     * 所属知识源
     */
    @NonNull
    String sourceId;

    /**
     * 文本内容，保持原文不做规范化
     */
    @NonNull
    String text;

    /**
     * 排序: Chunk 在文件中的索引位置，从 0 开始连续递增
     */
    int chunkIndex;

    /**
     * 在原始文本中的起始偏移（含）
     */
    int startChar;

    /**
     * 在原始文本中的结束偏移（不含）
     */
    int endChar;

    /**
     * 扩展元数据: chunk_index, char_start, char_end 等
     */
    @Builder.Default
    Map<String, Object> metadata = Collections.emptyMap();

    float[] embedding;

    String embeddingModel;

    LocalDateTime embeddedAt;

    Integer embeddingDimensions;

    /**
     * 文本长度，按码点计算，与 startChar/endChar 一致
     */
    public int getTextLength() {
        return text.codePointCount(0, text.length());
    }

    /**
     * 返回向量副本，外部修改不影响已写入的向量
     */
    public float[] getEmbedding() {
        return embedding == null ? null : embedding.clone();
    }

    public boolean hasEmbedding() {
        return embedding != null && embedding.length > 0;
    }

    public Integer getEmbeddingDimension() {
        return embedding == null ? null : embedding.length;
    }

    /**
     * 返回带有向量的新 Chunk，原对象保持不变
     * 向量一旦写入即不可再修改，内容变化时应整体替换 Chunk
     */
    public Chunk withEmbedding(float[] vector, String model, LocalDateTime at) {
        if (hasEmbedding()) {
            throw new KnowledgeValidationException(
                    "Chunk already has an embedding: " + chunkId, "embedding", chunkId);
        }
        return toBuilder()
                .embedding(vector)
                .embeddingModel(model)
                .embeddedAt(at)
                .embeddingDimensions(vector == null ? null : vector.length)
                .build();
    }

    public static class ChunkBuilder {

        // 构建时复制，调用方持有的数组与 Chunk 互不影响
        public ChunkBuilder embedding(float[] embedding) {
            this.embedding = embedding == null ? null : embedding.clone();
            return this;
        }
    }
}
