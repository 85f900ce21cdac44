package com.alibaba.cloud.ai.knowledge.store.backend;

import com.alibaba.cloud.ai.knowledge.backend.KnowledgeBackend;
import com.alibaba.cloud.ai.knowledge.domain.vo.BackendStats;
import com.alibaba.cloud.ai.knowledge.domain.vo.Chunk;
import com.alibaba.cloud.ai.knowledge.domain.vo.Source;
import com.alibaba.cloud.ai.knowledge.exception.KnowledgeIndexException;
import com.alibaba.cloud.ai.knowledge.exception.KnowledgeValidationException;
import com.alibaba.cloud.ai.knowledge.store.domain.entity.ChunkEntity;
import com.alibaba.cloud.ai.knowledge.store.domain.entity.SourceEntity;
import com.alibaba.cloud.ai.knowledge.store.mapper.ChunkMapper;
import com.alibaba.cloud.ai.knowledge.store.mapper.SourceMapper;
import com.baomidou.mybatisplus.core.conditions.query.QueryWrapper;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.transaction.annotation.Transactional;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 基于 MyBatis-Plus 的持久化存储后端
 * 向量与元数据以 JSON 形式存储在 knowledge_chunk 表中
 *
 * @author RobustH
 */
@Slf4j
public class MybatisKnowledgeBackend implements KnowledgeBackend {

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {
    };

    private final SourceMapper sourceMapper;
    private final ChunkMapper chunkMapper;
    private final ObjectMapper objectMapper;
    private final int embeddingDimension;

    public MybatisKnowledgeBackend(SourceMapper sourceMapper,
                                   ChunkMapper chunkMapper,
                                   ObjectMapper objectMapper,
                                   int embeddingDimension) {
        if (embeddingDimension <= 0) {
            throw new KnowledgeValidationException(
                    "embedding_dimension must be positive", "embedding_dimension", embeddingDimension);
        }
        this.sourceMapper = sourceMapper;
        this.chunkMapper = chunkMapper;
        this.objectMapper = objectMapper;
        this.embeddingDimension = embeddingDimension;
    }

    @Override
    public boolean sourceExists(String sourceId) {
        try {
            Long count = sourceMapper.selectCount(new QueryWrapper<SourceEntity>().eq("source_id", sourceId));
            return count != null && count > 0;
        } catch (RuntimeException e) {
            throw new KnowledgeIndexException("Failed to check source " + sourceId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String getSourceHash(String sourceId) {
        try {
            return sourceMapper.selectHashById(sourceId);
        } catch (RuntimeException e) {
            throw new KnowledgeIndexException("Failed to read hash of source " + sourceId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Set<String> getExistingSources() {
        try {
            return new HashSet<>(sourceMapper.selectAllSourceIds());
        } catch (RuntimeException e) {
            throw new KnowledgeIndexException("Failed to list sources: " + e.getMessage(), e);
        }
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public void addSource(Source source) {
        try {
            sourceMapper.insert(toEntity(source));
        } catch (RuntimeException e) {
            throw new KnowledgeIndexException("Failed to save source " + source.getSourceId() + ": " + e.getMessage(), e);
        }
        log.debug("已保存知识源: {} ({})", source.getSourceId(), source.getPath());
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public void addChunks(List<Chunk> chunks) {
        if (chunks.isEmpty()) {
            return;
        }
        List<ChunkEntity> entities = new ArrayList<>(chunks.size());
        for (Chunk chunk : chunks) {
            if (chunk.hasEmbedding() && chunk.getEmbeddingDimension() != embeddingDimension) {
                throw new KnowledgeValidationException(
                        "Embedding dimension mismatch: expected " + embeddingDimension
                                + ", got " + chunk.getEmbeddingDimension(),
                        "embedding_dimension", chunk.getEmbeddingDimension());
            }
            entities.add(toEntity(chunk));
        }
        try {
            chunkMapper.batchInsert(entities);
        } catch (RuntimeException e) {
            throw new KnowledgeIndexException("Failed to save chunks: " + e.getMessage(), e);
        }
        log.debug("已保存知识块 {} 个", entities.size());
    }

    /**
     * 先删知识块再删知识源
     */
    @Override
    @Transactional(rollbackFor = Exception.class)
    public void deleteSource(String sourceId) {
        try {
            int chunks = chunkMapper.deleteBySourceId(sourceId);
            sourceMapper.deleteById(sourceId);
            log.debug("已删除知识源: {}, 知识块 {} 个", sourceId, chunks);
        } catch (RuntimeException e) {
            throw new KnowledgeIndexException("Failed to delete source " + sourceId + ": " + e.getMessage(), e);
        }
    }

    /**
     * 按 chunkIndex 顺序读取某个知识源的知识块
     */
    public List<Chunk> getChunks(String sourceId) {
        List<ChunkEntity> entities;
        try {
            entities = chunkMapper.selectList(new QueryWrapper<ChunkEntity>()
                    .eq("source_id", sourceId)
                    .orderByAsc("chunk_index"));
        } catch (RuntimeException e) {
            throw new KnowledgeIndexException("Failed to read chunks of source " + sourceId + ": " + e.getMessage(), e);
        }
        List<Chunk> chunks = new ArrayList<>(entities.size());
        for (ChunkEntity entity : entities) {
            chunks.add(toChunk(entity));
        }
        return chunks;
    }

    @Override
    public BackendStats getStats() {
        try {
            Long sources = sourceMapper.selectCount(new QueryWrapper<>());
            Long chunks = chunkMapper.selectCount(new QueryWrapper<>());
            return BackendStats.builder()
                    .totalSources(sources == null ? 0 : sources)
                    .totalChunks(chunks == null ? 0 : chunks)
                    .totalEmbeddings(chunkMapper.countEmbedded())
                    .build();
        } catch (RuntimeException e) {
            throw new KnowledgeIndexException("Failed to read stats: " + e.getMessage(), e);
        }
    }

    @Override
    public int getEmbeddingDimension() {
        return embeddingDimension;
    }

    private SourceEntity toEntity(Source source) {
        return SourceEntity.builder()
                .sourceId(source.getSourceId())
                .path(source.getPath().toString())
                .fileSize(source.getFileSize())
                .mimeType(source.getMimeType())
                .mtime(source.getMtime())
                .sha256Hash(source.getSha256Hash())
                .loaderType(source.getLoaderType())
                .gitCommit(source.getGitCommit())
                .indexedAt(source.getIndexedAt())
                .chunkCount(source.getChunkCount())
                .build();
    }

    private ChunkEntity toEntity(Chunk chunk) {
        ChunkEntity entity = new ChunkEntity();
        entity.setChunkId(chunk.getChunkId());
        entity.setSourceId(chunk.getSourceId());
        entity.setContent(chunk.getText());
        entity.setChunkIndex(chunk.getChunkIndex());
        entity.setStartChar(chunk.getStartChar());
        entity.setEndChar(chunk.getEndChar());
        entity.setMetadata(writeJson(chunk.getMetadata()));
        entity.setEmbedding(chunk.hasEmbedding() ? writeJson(chunk.getEmbedding()) : null);
        entity.setEmbeddingModel(chunk.getEmbeddingModel());
        entity.setEmbeddedAt(chunk.getEmbeddedAt());
        entity.setEmbeddingDimensions(chunk.getEmbeddingDimensions());
        return entity;
    }

    private Chunk toChunk(ChunkEntity entity) {
        try {
            Map<String, Object> metadata = entity.getMetadata() == null
                    ? Map.of() : objectMapper.readValue(entity.getMetadata(), METADATA_TYPE);
            float[] embedding = entity.getEmbedding() == null
                    ? null : objectMapper.readValue(entity.getEmbedding(), float[].class);
            return Chunk.builder()
                    .chunkId(entity.getChunkId())
                    .sourceId(entity.getSourceId())
                    .text(entity.getContent())
                    .chunkIndex(entity.getChunkIndex())
                    .startChar(entity.getStartChar())
                    .endChar(entity.getEndChar())
                    .metadata(metadata)
                    .embedding(embedding)
                    .embeddingModel(entity.getEmbeddingModel())
                    .embeddedAt(entity.getEmbeddedAt())
                    .embeddingDimensions(entity.getEmbeddingDimensions())
                    .build();
        } catch (JsonProcessingException e) {
            throw new KnowledgeIndexException("Corrupted chunk data: " + entity.getChunkId(), e);
        }
    }

    private String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new KnowledgeIndexException("Failed to serialize chunk data: " + e.getMessage(), e);
        }
    }

    /**
     * 从实体还原知识源，供上层按路径展示已索引内容
     */
    public Source getSource(String sourceId) {
        SourceEntity entity;
        try {
            entity = sourceMapper.selectById(sourceId);
        } catch (RuntimeException e) {
            throw new KnowledgeIndexException("Failed to read source " + sourceId + ": " + e.getMessage(), e);
        }
        if (entity == null) {
            return null;
        }
        return Source.builder()
                .sourceId(entity.getSourceId())
                .path(Path.of(entity.getPath()))
                .fileSize(entity.getFileSize() == null ? 0 : entity.getFileSize())
                .mimeType(entity.getMimeType())
                .mtime(entity.getMtime())
                .sha256Hash(entity.getSha256Hash())
                .loaderType(entity.getLoaderType())
                .gitCommit(entity.getGitCommit())
                .indexedAt(entity.getIndexedAt())
                .chunkCount(entity.getChunkCount() == null ? 0 : entity.getChunkCount())
                .build();
    }
}
