package com.alibaba.cloud.ai.knowledge.config;

import com.alibaba.cloud.ai.knowledge.backend.DisabledKnowledgeBackend;
import com.alibaba.cloud.ai.knowledge.backend.InMemoryKnowledgeBackend;
import com.alibaba.cloud.ai.knowledge.backend.KnowledgeBackend;
import com.alibaba.cloud.ai.knowledge.service.EmbeddingClient;
import com.alibaba.cloud.ai.knowledge.service.FileLoader;
import com.alibaba.cloud.ai.knowledge.service.FileSourceLoader;
import com.alibaba.cloud.ai.knowledge.service.KnowledgeAvailabilityChecker;
import com.alibaba.cloud.ai.knowledge.service.KnowledgeIndexer;
import com.alibaba.cloud.ai.knowledge.service.SpringAiEmbeddingClient;
import com.alibaba.cloud.ai.knowledge.splitter.TextChunker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.AutoConfigureOrder;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.core.Ordered;

/**
 * 知识库索引配置
 * copilot.knowledge.enabled=false 时使用 DisabledKnowledgeBackend，应用正常启动但拒绝索引操作。
 * 排在其它自动配置之后，EmbeddingModel 由模型自动配置注册后才能被条件判断看到。
 *
 * @author RobustH
 */
@Slf4j
@AutoConfiguration
@AutoConfigureOrder(Ordered.LOWEST_PRECEDENCE)
public class KnowledgeIndexerConfig {

    @Value("${copilot.knowledge.enabled:true}")
    private boolean enabled;

    @Value("${copilot.knowledge.chunker.chunk-size:1000}")
    private int chunkSize;

    @Value("${copilot.knowledge.chunker.chunk-overlap:200}")
    private int chunkOverlap;

    @Value("${copilot.knowledge.chunker.min-chunk-size:100}")
    private int minChunkSize;

    @Value("${copilot.knowledge.chunker.respect-sentence-boundaries:true}")
    private boolean respectSentenceBoundaries;

    @Value("${copilot.knowledge.chunker.respect-paragraph-boundaries:true}")
    private boolean respectParagraphBoundaries;

    @Value("${copilot.knowledge.loader.max-file-size:10485760}")
    private long maxFileSize;

    @Value("${copilot.knowledge.embedding.model:text-embedding-3-small}")
    private String embeddingModel;

    @Value("${copilot.knowledge.embedding.dimension:1536}")
    private int embeddingDimension;

    /**
     * 参数非法时抛出 KnowledgeValidationException，启动失败
     */
    @Bean
    @ConditionalOnMissingBean
    public TextChunker textChunker() {
        TextChunker chunker = TextChunker.builder()
                .chunkSize(chunkSize)
                .chunkOverlap(chunkOverlap)
                .minChunkSize(minChunkSize)
                .respectSentenceBoundaries(respectSentenceBoundaries)
                .respectParagraphBoundaries(respectParagraphBoundaries)
                .build();
        log.info("文本切割器已初始化: 块大小={}, 重叠={}, 最小块={}", chunkSize, chunkOverlap, minChunkSize);
        return chunker;
    }

    @Bean
    @ConditionalOnMissingBean
    public FileLoader fileLoader() {
        return new FileSourceLoader(maxFileSize);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(EmbeddingModel.class)
    public EmbeddingClient embeddingClient(EmbeddingModel embeddingModel) {
        return new SpringAiEmbeddingClient(embeddingModel);
    }

    @Bean
    @ConditionalOnMissingBean
    public KnowledgeBackend knowledgeBackend() {
        if (!enabled) {
            return new DisabledKnowledgeBackend();
        }
        log.info("未配置持久化存储，使用内存存储后端: 向量维度={}", embeddingDimension);
        return new InMemoryKnowledgeBackend(embeddingDimension);
    }

    @Bean
    @ConditionalOnMissingBean
    public KnowledgeAvailabilityChecker knowledgeAvailabilityChecker(KnowledgeBackend knowledgeBackend) {
        return new KnowledgeAvailabilityChecker(knowledgeBackend);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(EmbeddingClient.class)
    public KnowledgeIndexer knowledgeIndexer(KnowledgeBackend knowledgeBackend,
                                             FileLoader fileLoader,
                                             TextChunker textChunker,
                                             EmbeddingClient embeddingClient) {
        return new KnowledgeIndexer(knowledgeBackend, fileLoader, textChunker, embeddingClient, embeddingModel);
    }
}
