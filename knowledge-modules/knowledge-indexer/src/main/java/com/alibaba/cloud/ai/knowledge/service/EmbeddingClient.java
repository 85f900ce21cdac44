package com.alibaba.cloud.ai.knowledge.service;

import java.util.List;

/**
 * 向量模型客户端
 */
public interface EmbeddingClient {

    /**
     * 批量生成向量
     *
     * @param texts 有序文本列表
     * @return 与输入等长、顺序一致的向量列表
     */
    List<float[]> getEmbeddings(List<String> texts);
}
