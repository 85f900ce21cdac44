package com.alibaba.cloud.ai.knowledge.exception;

/**
 * 索引过程失败：目录不存在、文件加载失败、向量生成失败或存储写入失败
 *
 * @author RobustH
 */
public class KnowledgeIndexException extends KnowledgeException {

    public KnowledgeIndexException(String message) {
        super(message);
    }

    public KnowledgeIndexException(String message, Throwable cause) {
        super(message, cause);
    }
}
