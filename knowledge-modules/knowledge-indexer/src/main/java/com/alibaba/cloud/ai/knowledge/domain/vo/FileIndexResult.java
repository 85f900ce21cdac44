package com.alibaba.cloud.ai.knowledge.domain.vo;

import lombok.Builder;
import lombok.Value;

/**
 * 单个文件的索引结果
 *
 * @author RobustH
 */
@Value
@Builder
public class FileIndexResult {

    boolean processed;

    boolean skipped;

    int chunksCreated;

    int embeddingsCreated;

    /**
     * 失败原因，成功或跳过时为空
     */
    String error;

    String sourceId;

    public static FileIndexResult skipped(String sourceId) {
        return FileIndexResult.builder()
                .skipped(true)
                .sourceId(sourceId)
                .build();
    }

    public static FileIndexResult processed(String sourceId, int chunksCreated, int embeddingsCreated) {
        return FileIndexResult.builder()
                .processed(true)
                .chunksCreated(chunksCreated)
                .embeddingsCreated(embeddingsCreated)
                .sourceId(sourceId)
                .build();
    }
}
