package com.alibaba.cloud.ai.knowledge.exception;

/**
 * 参数/配置校验失败
 * 例如切割器参数非法、文件类型不支持、文件过大等
 *
 * @author RobustH
 */
public class KnowledgeValidationException extends KnowledgeException {

    /**
     * 校验失败的字段名，可能为空
     */
    private final String field;

    /**
     * 校验失败的取值，可能为空
     */
    private final Object value;

    public KnowledgeValidationException(String message) {
        this(message, null, null);
    }

    public KnowledgeValidationException(String message, String field, Object value) {
        super(message);
        this.field = field;
        this.value = value;
    }

    public KnowledgeValidationException(String message, String field, Object value, Throwable cause) {
        super(message, cause);
        this.field = field;
        this.value = value;
    }

    public String getField() {
        return field;
    }

    public Object getValue() {
        return value;
    }
}
