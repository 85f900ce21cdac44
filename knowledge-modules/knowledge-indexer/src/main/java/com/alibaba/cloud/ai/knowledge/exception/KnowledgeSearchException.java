package com.alibaba.cloud.ai.knowledge.exception;

/**
 * 检索失败，由存储后端抛出
 */
public class KnowledgeSearchException extends KnowledgeException {

    public KnowledgeSearchException(String message) {
        super(message);
    }

    public KnowledgeSearchException(String message, Throwable cause) {
        super(message, cause);
    }
}
