package com.alibaba.cloud.ai.knowledge.store.config;

import com.alibaba.cloud.ai.knowledge.backend.KnowledgeBackend;
import com.alibaba.cloud.ai.knowledge.config.KnowledgeIndexerConfig;
import com.alibaba.cloud.ai.knowledge.store.backend.MybatisKnowledgeBackend;
import com.alibaba.cloud.ai.knowledge.store.mapper.ChunkMapper;
import com.alibaba.cloud.ai.knowledge.store.mapper.SourceMapper;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.mybatis.spring.annotation.MapperScan;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

/**
 * 持久化存储配置
 * copilot.knowledge.store.type=mybatis 时用数据库后端替换默认的内存后端
 *
 * @author RobustH
 */
@Slf4j
@AutoConfiguration(before = KnowledgeIndexerConfig.class)
@ConditionalOnProperty(name = "copilot.knowledge.store.type", havingValue = "mybatis")
@MapperScan("com.alibaba.cloud.ai.knowledge.store.mapper")
public class KnowledgeStoreAutoConfiguration {

    @Value("${copilot.knowledge.embedding.dimension:1536}")
    private int embeddingDimension;

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(name = "copilot.knowledge.enabled", havingValue = "true", matchIfMissing = true)
    public KnowledgeBackend knowledgeBackend(SourceMapper sourceMapper,
                                             ChunkMapper chunkMapper,
                                             ObjectProvider<ObjectMapper> objectMapper) {
        log.info("知识库存储后端: MyBatis, 向量维度={}", embeddingDimension);
        return new MybatisKnowledgeBackend(sourceMapper, chunkMapper,
                objectMapper.getIfAvailable(ObjectMapper::new), embeddingDimension);
    }
}
