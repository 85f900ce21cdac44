package com.alibaba.cloud.ai.knowledge.domain.vo;

import lombok.Data;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 批量索引汇总
 * 单个文件的失败只会累加到 errorFiles，不会中断整批处理
 *
 * @author RobustH
 */
@Data
public class IndexSummary {

    private int totalFiles;

    private int processedFiles;

    private int skippedFiles;

    private int errorFiles;

    private int totalChunks;

    private int totalEmbeddings;

    /**
     * 每个失败文件一条，格式为 "路径: 原因"
     */
    private List<String> errors = new ArrayList<>();

    public void record(FileIndexResult result) {
        if (result.isSkipped()) {
            skippedFiles++;
            return;
        }
        if (result.isProcessed()) {
            processedFiles++;
            totalChunks += result.getChunksCreated();
            totalEmbeddings += result.getEmbeddingsCreated();
        }
    }

    public void recordError(Path file, String message) {
        errorFiles++;
        errors.add(file + ": " + message);
    }
}
