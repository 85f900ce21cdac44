package com.alibaba.cloud.ai.knowledge.store.domain.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 知识块实体
 */
@Data
@TableName("knowledge_chunk")
public class ChunkEntity {

    /** sourceId_chunkIndex */
    @TableId(type = IdType.INPUT)
    private String chunkId;

    private String sourceId;

    /** 知识块原文 */
    private String content;

    private Integer chunkIndex;

    private Integer startChar;

    private Integer endChar;

    /** 元数据 JSON */
    private String metadata;

    /** 向量 JSON 数组，未生成向量时为空 */
    private String embedding;

    private String embeddingModel;

    private LocalDateTime embeddedAt;

    private Integer embeddingDimensions;
}
