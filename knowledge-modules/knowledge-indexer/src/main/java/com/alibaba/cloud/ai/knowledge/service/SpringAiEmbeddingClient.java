package com.alibaba.cloud.ai.knowledge.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.embedding.EmbeddingModel;

import java.util.List;

/**
 * 基于 Spring AI EmbeddingModel 的向量客户端
 *
 * @author RobustH
 */
@Slf4j
@RequiredArgsConstructor
public class SpringAiEmbeddingClient implements EmbeddingClient {

    private final EmbeddingModel embeddingModel;

    @Override
    public List<float[]> getEmbeddings(List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }
        log.debug("请求向量模型: {} 条文本", texts.size());
        return embeddingModel.embed(texts);
    }
}
