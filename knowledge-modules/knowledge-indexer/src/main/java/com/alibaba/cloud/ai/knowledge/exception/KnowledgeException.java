package com.alibaba.cloud.ai.knowledge.exception;

/**
 * 知识库模块异常基类
 * 所有知识库相关异常均继承自该类，调用方可统一捕获
 *
 * @author RobustH
 */
public class KnowledgeException extends RuntimeException {

    public KnowledgeException(String message) {
        super(message);
    }

    public KnowledgeException(String message, Throwable cause) {
        super(message, cause);
    }
}
