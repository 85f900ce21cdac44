package com.alibaba.cloud.ai.knowledge.store.domain.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 知识源实体
 * 每个被索引的文件一行，sha256_hash 用于增量索引检查
 *
 * @author RobustH
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@TableName("knowledge_source")
public class SourceEntity {

    @TableId(type = IdType.INPUT)
    private String sourceId;

    /**
     * 文件绝对路径
     */
    private String path;

    private Long fileSize;

    private String mimeType;

    private LocalDateTime mtime;

    /**
     * 内容哈希 (SHA-256)
     */
    private String sha256Hash;

    private String loaderType;

    private String gitCommit;

    private LocalDateTime indexedAt;

    private Integer chunkCount;
}
