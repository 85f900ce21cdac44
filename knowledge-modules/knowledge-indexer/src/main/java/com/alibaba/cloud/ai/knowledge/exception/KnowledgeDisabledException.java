package com.alibaba.cloud.ai.knowledge.exception;

/**
 * 知识库功能被关闭时抛出
 */
public class KnowledgeDisabledException extends KnowledgeException {

    public static final String DEFAULT_MESSAGE = "Knowledge functionality is disabled";

    public KnowledgeDisabledException() {
        super(DEFAULT_MESSAGE);
    }

    public KnowledgeDisabledException(String message) {
        super(message);
    }
}
