package com.alibaba.cloud.ai.knowledge.domain.vo;

import com.alibaba.cloud.ai.knowledge.utils.FileTypeClassifier;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.nio.file.Path;
import java.time.LocalDateTime;

/**
 * 知识源模型
 * 一个被索引的文件，由稳定的 sourceId 和内容哈希标识
 *
 * @author RobustH
 */
@Value
@Builder(toBuilder = true)
public class Source {

    /**
     * 唯一标识，同一路径在内容变化前后保持不变
     */
    @NonNull
    String sourceId;

    /**
     * 文件路径
     */
    @NonNull
    Path path;

    /**
     * 文件大小（字节）
     */
    long fileSize;

    @NonNull
    String mimeType;

    /**
     * 文件最后修改时间
     */
    @NonNull
    LocalDateTime mtime;

    /**
     * 增量索引: 内容的 SHA-256 哈希，唯一的变更判断依据
     */
    @NonNull
    String sha256Hash;

    /**
     * 加载器类型 (markdown, python, text ...)
     */
    String loaderType;

    String gitCommit;

    @Builder.Default
    LocalDateTime indexedAt = LocalDateTime.now();

    @Builder.Default
    int chunkCount = 0;

    /**
     * 小写扩展名，不含点
     */
    public String getFileExtension() {
        return FileTypeClassifier.getExtension(path);
    }

    public boolean isTextFile() {
        return FileTypeClassifier.isTextExtension(getFileExtension());
    }
}
