package com.alibaba.cloud.ai.knowledge.service;

import com.alibaba.cloud.ai.knowledge.domain.vo.Source;
import com.alibaba.cloud.ai.knowledge.exception.KnowledgeIndexException;
import com.alibaba.cloud.ai.knowledge.exception.KnowledgeValidationException;
import com.alibaba.cloud.ai.knowledge.utils.FileTypeClassifier;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.HexFormat;
import java.util.Set;

/**
 * 本地文件加载器
 * 只接受纯文本类文件，按 UTF-8 读取，非法字节序列时回退到 ISO-8859-1
 *
 * @author RobustH
 */
@Slf4j
@Getter
public class FileSourceLoader implements FileLoader {

    public static final long DEFAULT_MAX_FILE_SIZE = 10L * 1024 * 1024;

    public static final Set<String> SUPPORTED_EXTENSIONS = Set.of(
            ".md", ".txt", ".py", ".log", ".rst", ".yaml", ".yml", ".json"
    );

    private static final int SOURCE_ID_LENGTH = 16;

    private final long maxFileSize;

    public FileSourceLoader() {
        this(DEFAULT_MAX_FILE_SIZE);
    }

    public FileSourceLoader(long maxFileSize) {
        if (maxFileSize <= 0) {
            throw new KnowledgeValidationException("max_file_size must be positive", "max_file_size", maxFileSize);
        }
        this.maxFileSize = maxFileSize;
    }

    public boolean isSupportedFile(Path path) {
        String extension = FileTypeClassifier.getExtension(path);
        return !extension.isEmpty() && SUPPORTED_EXTENSIONS.contains("." + extension);
    }

    @Override
    public Source loadSource(Path path) {
        Path absolute = path.toAbsolutePath().normalize();
        if (!Files.exists(absolute)) {
            throw new KnowledgeIndexException("Source file not found: " + path);
        }
        if (!Files.isRegularFile(absolute)) {
            throw new KnowledgeValidationException("Path is not a file: " + path, "path", path.toString());
        }
        if (!isSupportedFile(absolute)) {
            throw new KnowledgeValidationException("Unsupported file type: " + path,
                    "extension", FileTypeClassifier.getExtension(absolute));
        }

        try {
            long size = Files.size(absolute);
            if (size > maxFileSize) {
                throw new KnowledgeValidationException(
                        "File too large: " + path + " (" + size + " bytes, max " + maxFileSize + ")",
                        "file_size", size);
            }
            byte[] content = Files.readAllBytes(absolute);
            LocalDateTime mtime = LocalDateTime.ofInstant(
                    Files.getLastModifiedTime(absolute).toInstant(), ZoneId.systemDefault());

            return Source.builder()
                    .sourceId(sourceIdFor(absolute))
                    .path(absolute)
                    .fileSize(content.length)
                    .mimeType(FileTypeClassifier.detectMimeType(absolute))
                    .mtime(mtime)
                    .sha256Hash(sha256Hex(content))
                    .loaderType(FileTypeClassifier.detectLoaderType(absolute))
                    .build();
        } catch (IOException e) {
            throw new KnowledgeIndexException("Failed to read source file: " + path, e);
        }
    }

    /**
     * 读取并解码文件内容
     *
     * @throws KnowledgeIndexException 文件在 loadSource 之后被修改
     */
    @Override
    public String extractText(Source source) {
        byte[] content;
        try {
            content = Files.readAllBytes(source.getPath());
        } catch (IOException e) {
            throw new KnowledgeValidationException("Could not decode file: " + source.getPath(),
                    "path", source.getPath().toString(), e);
        }
        // 解码的内容必须与 loadSource 计算哈希时的内容一致
        if (source.getSha256Hash() != null && !source.getSha256Hash().equals(sha256Hex(content))) {
            throw new KnowledgeIndexException("Source file changed since it was loaded: " + source.getPath());
        }
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(content))
                    .toString();
        } catch (CharacterCodingException e) {
            log.debug("文件不是合法的 UTF-8，按 ISO-8859-1 读取: {}", source.getPath());
            return new String(content, StandardCharsets.ISO_8859_1);
        }
    }

    /**
     * 路径不存在时也能计算，便于删除已从磁盘移除的文件
     */
    @Override
    public String resolveSourceId(Path path) {
        return sourceIdFor(path);
    }

    /**
     * 基于绝对路径生成稳定的 sourceId，内容变化不影响 id
     */
    public static String sourceIdFor(Path path) {
        String normalized = path.toAbsolutePath().normalize().toString();
        return sha256Hex(normalized.getBytes(StandardCharsets.UTF_8)).substring(0, SOURCE_ID_LENGTH);
    }

    static String sha256Hex(byte[] data) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(data));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }
}
