package com.alibaba.cloud.ai.knowledge.service;

import com.alibaba.cloud.ai.knowledge.domain.vo.Source;

import java.nio.file.Path;

/**
 * 文件加载器
 * 负责文件类型识别、内容哈希和文本提取
 *
 * @author RobustH
 */
public interface FileLoader {

    /**
     * 加载文件元数据并计算内容哈希
     *
     * @throws com.alibaba.cloud.ai.knowledge.exception.KnowledgeException 文件不可读或类型不支持
     */
    Source loadSource(Path path);

    /**
     * 提取文件的文本内容
     */
    String extractText(Source source);

    /**
     * 解析路径对应的 sourceId
     */
    default String resolveSourceId(Path path) {
        return loadSource(path).getSourceId();
    }
}
