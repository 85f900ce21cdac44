package com.alibaba.cloud.ai.knowledge.backend;

import com.alibaba.cloud.ai.knowledge.domain.vo.BackendStats;
import com.alibaba.cloud.ai.knowledge.domain.vo.Chunk;
import com.alibaba.cloud.ai.knowledge.domain.vo.Source;
import com.alibaba.cloud.ai.knowledge.exception.KnowledgeValidationException;
import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * 内存存储后端
 * 未配置持久化存储时的默认实现，进程退出后数据丢失
 *
 * @author RobustH
 */
@Slf4j
public class InMemoryKnowledgeBackend implements KnowledgeBackend {

    private final int embeddingDimension;

    private final Map<String, Source> sources = new ConcurrentHashMap<>();

    // sourceId -> (chunkId -> chunk)
    private final Map<String, Map<String, Chunk>> chunksBySource = new ConcurrentHashMap<>();

    public InMemoryKnowledgeBackend(int embeddingDimension) {
        if (embeddingDimension <= 0) {
            throw new KnowledgeValidationException(
                    "embedding_dimension must be positive", "embedding_dimension", embeddingDimension);
        }
        this.embeddingDimension = embeddingDimension;
    }

    @Override
    public boolean sourceExists(String sourceId) {
        return sources.containsKey(sourceId);
    }

    @Override
    public String getSourceHash(String sourceId) {
        Source source = sources.get(sourceId);
        return source == null ? null : source.getSha256Hash();
    }

    @Override
    public Set<String> getExistingSources() {
        return Set.copyOf(sources.keySet());
    }

    @Override
    public void addSource(Source source) {
        sources.put(source.getSourceId(), source);
        log.debug("已保存知识源: {} ({})", source.getSourceId(), source.getPath());
    }

    @Override
    public void addChunks(List<Chunk> chunks) {
        for (Chunk chunk : chunks) {
            if (!sources.containsKey(chunk.getSourceId())) {
                throw new KnowledgeValidationException(
                        "Unknown source for chunk " + chunk.getChunkId() + ": " + chunk.getSourceId(),
                        "source_id", chunk.getSourceId());
            }
            if (chunk.hasEmbedding() && chunk.getEmbeddingDimension() != embeddingDimension) {
                throw new KnowledgeValidationException(
                        "Embedding dimension mismatch: expected " + embeddingDimension
                                + ", got " + chunk.getEmbeddingDimension(),
                        "embedding_dimension", chunk.getEmbeddingDimension());
            }
        }
        for (Chunk chunk : chunks) {
            chunksBySource.computeIfAbsent(chunk.getSourceId(), id -> new ConcurrentHashMap<>())
                    .put(chunk.getChunkId(), chunk);
        }
    }

    @Override
    public void deleteSource(String sourceId) {
        Map<String, Chunk> removed = chunksBySource.remove(sourceId);
        sources.remove(sourceId);
        log.debug("已删除知识源: {}, 知识块 {} 个", sourceId, removed == null ? 0 : removed.size());
    }

    /**
     * 按 chunkIndex 顺序返回某个 Source 的知识块
     */
    public List<Chunk> getChunks(String sourceId) {
        Map<String, Chunk> chunks = chunksBySource.getOrDefault(sourceId, Map.of());
        return chunks.values().stream()
                .sorted(Comparator.comparingInt(Chunk::getChunkIndex))
                .collect(Collectors.toList());
    }

    public Source getSource(String sourceId) {
        return sources.get(sourceId);
    }

    @Override
    public BackendStats getStats() {
        long totalChunks = 0;
        long totalEmbeddings = 0;
        for (Map<String, Chunk> chunks : chunksBySource.values()) {
            for (Chunk chunk : chunks.values()) {
                totalChunks++;
                if (chunk.hasEmbedding()) {
                    totalEmbeddings++;
                }
            }
        }
        return BackendStats.builder()
                .totalSources(sources.size())
                .totalChunks(totalChunks)
                .totalEmbeddings(totalEmbeddings)
                .build();
    }

    @Override
    public int getEmbeddingDimension() {
        return embeddingDimension;
    }
}
