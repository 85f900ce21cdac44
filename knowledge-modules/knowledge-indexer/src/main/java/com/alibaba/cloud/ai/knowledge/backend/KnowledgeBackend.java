package com.alibaba.cloud.ai.knowledge.backend;

import com.alibaba.cloud.ai.knowledge.domain.vo.BackendStats;
import com.alibaba.cloud.ai.knowledge.domain.vo.Chunk;
import com.alibaba.cloud.ai.knowledge.domain.vo.Source;

import java.util.List;
import java.util.Set;

/**
 * 知识库存储后端
 * 持久化 Source、Chunk 及其向量，索引器只通过该接口读写存储
 *
 * @author RobustH
 */
public interface KnowledgeBackend {

    boolean sourceExists(String sourceId);

    /**
     * 获取已存储的内容哈希
     *
     * @return 哈希值，未索引时返回 null
     */
    String getSourceHash(String sourceId);

    /**
     * 获取所有已索引的 sourceId
     */
    Set<String> getExistingSources();

    void addSource(Source source);

    /**
     * 写入知识块，所属 Source 必须已存在
     */
    void addChunks(List<Chunk> chunks);

    /**
     * 删除 Source 及其全部知识块和向量
     */
    void deleteSource(String sourceId);

    BackendStats getStats();

    /**
     * 后端期望的向量维度
     */
    int getEmbeddingDimension();
}
