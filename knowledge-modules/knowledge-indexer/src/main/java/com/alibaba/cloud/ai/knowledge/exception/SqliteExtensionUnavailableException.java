package com.alibaba.cloud.ai.knowledge.exception;

/**
 * 存储后端依赖的 SQLite 向量扩展不可用
 */
public class SqliteExtensionUnavailableException extends KnowledgeException {

    private final String extensionName;

    public SqliteExtensionUnavailableException(String extensionName) {
        this(extensionName, "SQLite extension '" + extensionName + "' is not available");
    }

    public SqliteExtensionUnavailableException(String extensionName, String message) {
        super(message);
        this.extensionName = extensionName;
    }

    public String getExtensionName() {
        return extensionName;
    }
}
