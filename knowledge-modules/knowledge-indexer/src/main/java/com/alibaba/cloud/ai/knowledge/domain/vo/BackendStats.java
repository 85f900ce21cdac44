package com.alibaba.cloud.ai.knowledge.domain.vo;

import lombok.Builder;
import lombok.Value;

/**
 * 存储后端统计
 */
@Value
@Builder
public class BackendStats {

    long totalSources;

    long totalChunks;

    long totalEmbeddings;
}
