package com.alibaba.cloud.ai.knowledge.service;

import com.alibaba.cloud.ai.knowledge.backend.KnowledgeBackend;
import com.alibaba.cloud.ai.knowledge.domain.vo.Chunk;
import com.alibaba.cloud.ai.knowledge.domain.vo.FileIndexResult;
import com.alibaba.cloud.ai.knowledge.domain.vo.IndexStats;
import com.alibaba.cloud.ai.knowledge.domain.vo.IndexSummary;
import com.alibaba.cloud.ai.knowledge.domain.vo.Source;
import com.alibaba.cloud.ai.knowledge.exception.KnowledgeDisabledException;
import com.alibaba.cloud.ai.knowledge.exception.KnowledgeIndexException;
import com.alibaba.cloud.ai.knowledge.exception.KnowledgeSearchException;
import com.alibaba.cloud.ai.knowledge.exception.KnowledgeValidationException;
import com.alibaba.cloud.ai.knowledge.exception.SqliteExtensionUnavailableException;
import com.alibaba.cloud.ai.knowledge.splitter.TextChunker;
import com.alibaba.cloud.ai.knowledge.utils.FileScanner;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * 知识库索引编排器
 * 核心类，负责文件发现、基于内容哈希的增量判断、切割、批量生成向量以及写入存储后端
 *
 * 同一次调用内按输入顺序串行处理文件；单个文件的失败记入汇总，不会中断整批。
 *
 * @author RobustH
 */
@Slf4j
public class KnowledgeIndexer {

    public static final String DEFAULT_EMBEDDING_MODEL = "text-embedding-3-small";

    private final KnowledgeBackend backend;
    private final FileLoader fileLoader;
    private final TextChunker chunker;
    private final EmbeddingClient embeddingClient;
    private final String embeddingModel;
    private final FileScanner fileScanner = new FileScanner();

    public KnowledgeIndexer(KnowledgeBackend backend,
                            FileLoader fileLoader,
                            TextChunker chunker,
                            EmbeddingClient embeddingClient) {
        this(backend, fileLoader, chunker, embeddingClient, null);
    }

    public KnowledgeIndexer(KnowledgeBackend backend,
                            FileLoader fileLoader,
                            TextChunker chunker,
                            EmbeddingClient embeddingClient,
                            String embeddingModel) {
        this.backend = requireCollaborator(backend, "backend");
        this.fileLoader = requireCollaborator(fileLoader, "file_loader");
        this.chunker = requireCollaborator(chunker, "chunker");
        this.embeddingClient = requireCollaborator(embeddingClient, "embedding_client");
        this.embeddingModel = embeddingModel == null || embeddingModel.isBlank()
                ? DEFAULT_EMBEDDING_MODEL : embeddingModel;
    }

    public String getEmbeddingModel() {
        return embeddingModel;
    }

    public IndexSummary indexDirectory(Path directory) {
        return indexDirectory(directory, true, false);
    }

    public IndexSummary indexDirectory(Path directory, boolean recursive) {
        return indexDirectory(directory, recursive, false);
    }

    /**
     * 索引目录下的文件
     *
     * @param directory    根目录
     * @param recursive    是否遍历子目录
     * @param forceReindex true 时忽略哈希比对，全部重新处理
     */
    public IndexSummary indexDirectory(Path directory, boolean recursive, boolean forceReindex) {
        if (!Files.exists(directory)) {
            throw new KnowledgeIndexException("Directory does not exist: " + directory);
        }
        if (!Files.isDirectory(directory)) {
            throw new KnowledgeIndexException("Path is not a directory: " + directory);
        }

        log.info("开始索引目录: 路径={}, 递归={}, 强制重建={}", directory, recursive, forceReindex);
        List<Path> files = fileScanner.scan(directory, recursive);
        return indexFiles(files, forceReindex);
    }

    public IndexSummary indexFiles(List<Path> files) {
        return indexFiles(files, false);
    }

    /**
     * 按顺序索引文件列表
     * 每个文件独立成败，失败原因写入 {@link IndexSummary#getErrors()}
     */
    public IndexSummary indexFiles(List<Path> files, boolean forceReindex) {
        IndexSummary summary = new IndexSummary();
        if (files == null || files.isEmpty()) {
            return summary;
        }
        summary.setTotalFiles(files.size());

        Set<String> existingSources = backend.getExistingSources();

        for (Path file : files) {
            try {
                FileIndexResult result = indexFile(file, existingSources, forceReindex);
                summary.record(result);
            } catch (RuntimeException e) {
                log.warn("索引文件失败: {}", file, e);
                summary.recordError(file, e.getMessage());
            }
        }

        log.info("索引完成. 总数: {}, 处理: {}, 跳过: {}, 错误: {}, 知识块: {}, 向量: {}",
                summary.getTotalFiles(), summary.getProcessedFiles(), summary.getSkippedFiles(),
                summary.getErrorFiles(), summary.getTotalChunks(), summary.getTotalEmbeddings());
        return summary;
    }

    public IndexSummary reindexChangedFiles(Path directory) {
        return reindexChangedFiles(directory, true);
    }

    /**
     * 增量更新: 只处理新增和内容变化的文件
     */
    public IndexSummary reindexChangedFiles(Path directory, boolean recursive) {
        return indexDirectory(directory, recursive, false);
    }

    /**
     * 索引单个文件
     *
     * @param file            文件路径
     * @param existingSources 已索引的 sourceId 集合，用于增量判断
     * @param forceReindex    是否忽略哈希比对
     * @throws KnowledgeIndexException 加载、切割、写入失败；检索/禁用/扩展不可用类异常原样传播
     */
    public FileIndexResult indexFile(Path file, Set<String> existingSources, boolean forceReindex) {
        try {
            return doIndexFile(file, existingSources, forceReindex);
        } catch (KnowledgeIndexException | KnowledgeSearchException
                 | KnowledgeDisabledException | SqliteExtensionUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new KnowledgeIndexException("Failed to index " + file + ": " + e.getMessage(), e);
        }
    }

    private FileIndexResult doIndexFile(Path file, Set<String> existingSources, boolean forceReindex) {
        // 1. 加载
        Source source = fileLoader.loadSource(file);
        String sourceId = source.getSourceId();
        boolean alreadyIndexed = existingSources.contains(sourceId);

        // 2. 哈希比对
        if (!forceReindex && alreadyIndexed
                && source.getSha256Hash().equals(backend.getSourceHash(sourceId))) {
            log.debug("内容未变化，跳过: {}", file);
            return FileIndexResult.skipped(sourceId);
        }

        // 3. 切割
        String text = fileLoader.extractText(source);
        List<Chunk> chunks = chunker.chunkTextToList(sourceId, text);

        // 4. 每个文件一次批量请求
        List<String> texts = new ArrayList<>(chunks.size());
        chunks.forEach(chunk -> texts.add(chunk.getText()));
        List<float[]> embeddings = generateEmbeddings(texts);

        LocalDateTime now = LocalDateTime.now();
        List<Chunk> embedded = new ArrayList<>(chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            embedded.add(chunks.get(i).withEmbedding(embeddings.get(i), embeddingModel, now));
        }

        // 5. 整体替换写入
        Source toStore = source.toBuilder()
                .chunkCount(embedded.size())
                .indexedAt(now)
                .build();
        // 是否已索引以调用方传入的集合为准，不再逐个查询后端
        if (alreadyIndexed) {
            backend.deleteSource(sourceId);
        }
        backend.addSource(toStore);
        if (!embedded.isEmpty()) {
            writeChunks(sourceId, embedded);
        }

        log.debug("已索引文件: {}, 知识块 {} 个", file, embedded.size());
        return FileIndexResult.processed(sourceId, embedded.size(), embeddings.size());
    }

    // 写入失败时回滚已写入的 Source，不留下没有知识块的半成品
    private void writeChunks(String sourceId, List<Chunk> chunks) {
        try {
            backend.addChunks(chunks);
        } catch (RuntimeException e) {
            try {
                backend.deleteSource(sourceId);
            } catch (RuntimeException rollbackFailure) {
                e.addSuppressed(rollbackFailure);
            }
            throw e;
        }
    }

    /**
     * 批量生成向量
     *
     * @throws KnowledgeIndexException 模型调用失败或返回数量与输入不一致
     */
    public List<float[]> generateEmbeddings(List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }

        List<float[]> embeddings;
        try {
            embeddings = embeddingClient.getEmbeddings(texts);
        } catch (RuntimeException e) {
            throw new KnowledgeIndexException("Failed to generate embeddings: " + e.getMessage(), e);
        }

        if (embeddings == null || embeddings.size() != texts.size()) {
            throw new KnowledgeIndexException("Failed to generate embeddings: expected " + texts.size()
                    + " vectors, got " + (embeddings == null ? 0 : embeddings.size()));
        }
        return embeddings;
    }

    /**
     * 删除文件对应的 Source 及其知识块和向量
     */
    public void removeSource(Path path) {
        removeSource(fileLoader.resolveSourceId(path));
    }

    public void removeSource(String sourceId) {
        backend.deleteSource(sourceId);
        log.info("已删除知识源: {}", sourceId);
    }

    public IndexStats getIndexStats() {
        return IndexStats.builder()
                .backend(backend.getStats())
                .chunker(IndexStats.ChunkerSettings.builder()
                        .chunkSize(chunker.getChunkSize())
                        .chunkOverlap(chunker.getChunkOverlap())
                        .minChunkSize(chunker.getMinChunkSize())
                        .build())
                .embedding(IndexStats.EmbeddingSettings.builder()
                        .model(embeddingModel)
                        .dimension(backend.getEmbeddingDimension())
                        .build())
                .build();
    }

    private static <T> T requireCollaborator(T collaborator, String name) {
        if (collaborator == null) {
            throw new KnowledgeValidationException(name + " must not be null", name, null);
        }
        return collaborator;
    }
}
