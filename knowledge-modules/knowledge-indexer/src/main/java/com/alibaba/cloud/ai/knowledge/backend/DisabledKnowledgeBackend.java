package com.alibaba.cloud.ai.knowledge.backend;

import com.alibaba.cloud.ai.knowledge.domain.vo.BackendStats;
import com.alibaba.cloud.ai.knowledge.domain.vo.Chunk;
import com.alibaba.cloud.ai.knowledge.domain.vo.Source;
import com.alibaba.cloud.ai.knowledge.exception.KnowledgeDisabledException;

import java.util.List;
import java.util.Set;

/**
 * 知识库关闭时使用的后端，所有操作直接拒绝
 * 应用可以正常启动，调用方在首次访问时得到明确的异常
 *
 * @author RobustH
 */
public class DisabledKnowledgeBackend implements KnowledgeBackend {

    @Override
    public boolean sourceExists(String sourceId) {
        throw new KnowledgeDisabledException();
    }

    @Override
    public String getSourceHash(String sourceId) {
        throw new KnowledgeDisabledException();
    }

    @Override
    public Set<String> getExistingSources() {
        throw new KnowledgeDisabledException();
    }

    @Override
    public void addSource(Source source) {
        throw new KnowledgeDisabledException();
    }

    @Override
    public void addChunks(List<Chunk> chunks) {
        throw new KnowledgeDisabledException();
    }

    @Override
    public void deleteSource(String sourceId) {
        throw new KnowledgeDisabledException();
    }

    @Override
    public BackendStats getStats() {
        throw new KnowledgeDisabledException();
    }

    @Override
    public int getEmbeddingDimension() {
        throw new KnowledgeDisabledException();
    }
}
