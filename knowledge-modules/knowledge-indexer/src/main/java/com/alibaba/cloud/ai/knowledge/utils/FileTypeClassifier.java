package com.alibaba.cloud.ai.knowledge.utils;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 文件类型分类器
 * 根据文件扩展名识别 MIME 类型和加载器类型
 *
 * @author RobustH
 */
public final class FileTypeClassifier {

    // 可索引的纯文本扩展名
    public static final Set<String> TEXT_EXTENSIONS = Set.of(
            "md", "txt", "py", "log", "rst", "yaml", "yml", "json"
    );

    public static final String DEFAULT_LOADER_TYPE = "text";

    public static final String DEFAULT_MIME_TYPE = "text/plain";

    // 加载器类型识别
    private static final Map<String, String> EXTENSION_TO_LOADER = Map.ofEntries(
            Map.entry("md", "markdown"),
            Map.entry("markdown", "markdown"),
            Map.entry("py", "python"),
            Map.entry("txt", "text"),
            Map.entry("log", "text"),
            Map.entry("yaml", "yaml"),
            Map.entry("yml", "yaml"),
            Map.entry("json", "json"),
            Map.entry("rst", "rst")
    );

    private static final Map<String, String> EXTENSION_TO_MIME = Map.ofEntries(
            Map.entry("md", "text/markdown"),
            Map.entry("markdown", "text/markdown"),
            Map.entry("py", "text/x-python"),
            Map.entry("txt", "text/plain"),
            Map.entry("log", "text/plain"),
            Map.entry("rst", "text/x-rst"),
            Map.entry("yaml", "application/yaml"),
            Map.entry("yml", "application/yaml"),
            Map.entry("json", "application/json"),
            Map.entry("pdf", "application/pdf")
    );

    private FileTypeClassifier() {
    }

    /**
     * 获取文件扩展名（小写，不含点）
     * 无扩展名或隐藏文件（如 .hidden）返回空串
     */
    public static String getExtension(Path path) {
        if (path == null || path.getFileName() == null) {
            return "";
        }
        String fileName = path.getFileName().toString();
        int lastDotIndex = fileName.lastIndexOf('.');
        if (lastDotIndex <= 0 || lastDotIndex == fileName.length() - 1) {
            return "";
        }
        return fileName.substring(lastDotIndex + 1).toLowerCase(Locale.ROOT);
    }

    public static boolean isTextExtension(String extension) {
        return extension != null && TEXT_EXTENSIONS.contains(extension.toLowerCase(Locale.ROOT));
    }

    /**
     * 识别加载器类型，未知扩展名按纯文本处理
     */
    public static String detectLoaderType(Path path) {
        return EXTENSION_TO_LOADER.getOrDefault(getExtension(path), DEFAULT_LOADER_TYPE);
    }

    public static String detectMimeType(Path path) {
        return EXTENSION_TO_MIME.getOrDefault(getExtension(path), DEFAULT_MIME_TYPE);
    }
}
