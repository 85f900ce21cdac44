package com.alibaba.cloud.ai.knowledge.utils;

import com.alibaba.cloud.ai.knowledge.exception.KnowledgeIndexException;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;

/**
 * 文件扫描器
 * 遍历目录并返回其中的普通文件，不做类型过滤（由 FileLoader 决定能否加载）
 *
 * @author RobustH
 */
@Slf4j
public class FileScanner {

    /**
     * 扫描指定目录
     *
     * @param rootPath  根目录
     * @param recursive true 遍历整个子树，false 只看直接子文件
     * @return 按路径排序的文件列表
     */
    public List<Path> scan(Path rootPath, boolean recursive) {
        List<Path> files = new ArrayList<>();
        int maxDepth = recursive ? Integer.MAX_VALUE : 1;

        try {
            Files.walkFileTree(rootPath, EnumSet.noneOf(FileVisitOption.class), maxDepth, new SimpleFileVisitor<Path>() {
                @NotNull
                @Override
                public FileVisitResult visitFile(@NotNull Path file, @NotNull BasicFileAttributes attrs) {
                    // maxDepth 处的目录也会以 visitFile 回调
                    if (attrs.isRegularFile()) {
                        files.add(file);
                    }
                    return FileVisitResult.CONTINUE;
                }

                @NotNull
                @Override
                public FileVisitResult visitFileFailed(@NotNull Path file, @NotNull IOException exc) {
                    log.warn("无法访问文件: {}", file, exc);
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            throw new KnowledgeIndexException("Failed to scan directory: " + rootPath, e);
        }

        Collections.sort(files);
        log.info("扫描到 {} 个文件: {}", files.size(), rootPath);
        return files;
    }
}
