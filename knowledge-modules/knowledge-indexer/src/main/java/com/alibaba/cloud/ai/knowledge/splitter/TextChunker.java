package com.alibaba.cloud.ai.knowledge.splitter;

import com.alibaba.cloud.ai.knowledge.domain.vo.Chunk;
import com.alibaba.cloud.ai.knowledge.exception.KnowledgeValidationException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * 文本切割器
 * 将文本切割为长度受限、可重叠的知识块，供向量模型使用
 *
 * 切割规则:
 * - 空白文本不产生任何块
 * - 不超过 chunkSize 的文本整体作为一个块（保留原文，不做 trim）
 * - 否则从游标处截取最多 chunkSize 个字符的窗口；开启边界选项时，
 *   窗口右端回退到 [minChunkSize, chunkSize] 范围内最近的段落分隔（\n\n）或句末标点（. ! ?），
 *   段落边界优先于句子边界；范围内没有边界则在 chunkSize 处硬切
 * - 下一个窗口从 (上一窗口结束位置 - chunkOverlap) 开始，相邻块共享 chunkOverlap 个字符
 *
 * 长度与偏移量均按 Unicode 码点计算，emoji 等代理对不会被切开。
 * 实例创建后不可变，可在多线程间共享。
 *
 * @author RobustH
 */
@Slf4j
@Getter
public class TextChunker {

    public static final int DEFAULT_CHUNK_SIZE = 1000;
    public static final int DEFAULT_CHUNK_OVERLAP = 200;
    public static final int DEFAULT_MIN_CHUNK_SIZE = 100;

    private static final String PARAGRAPH_BREAK = "\n\n";

    private final int chunkSize;

    private final int chunkOverlap;

    private final int minChunkSize;

    private final boolean respectSentenceBoundaries;

    private final boolean respectParagraphBoundaries;

    public TextChunker() {
        this(DEFAULT_CHUNK_SIZE, DEFAULT_CHUNK_OVERLAP, DEFAULT_MIN_CHUNK_SIZE);
    }

    public TextChunker(int chunkSize, int chunkOverlap, int minChunkSize) {
        this(chunkSize, chunkOverlap, minChunkSize, true, true);
    }

    public TextChunker(int chunkSize,
                       int chunkOverlap,
                       int minChunkSize,
                       boolean respectSentenceBoundaries,
                       boolean respectParagraphBoundaries) {
        if (chunkSize <= 0) {
            throw new KnowledgeValidationException("chunk_size must be positive", "chunk_size", chunkSize);
        }
        if (chunkOverlap < 0) {
            throw new KnowledgeValidationException("chunk_overlap must be non-negative", "chunk_overlap", chunkOverlap);
        }
        if (chunkOverlap >= chunkSize) {
            throw new KnowledgeValidationException("chunk_overlap must be less than chunk_size", "chunk_overlap", chunkOverlap);
        }
        if (minChunkSize <= 0) {
            throw new KnowledgeValidationException("min_chunk_size must be positive", "min_chunk_size", minChunkSize);
        }
        if (minChunkSize > chunkSize) {
            throw new KnowledgeValidationException("min_chunk_size must be less than chunk_size", "min_chunk_size", minChunkSize);
        }
        this.chunkSize = chunkSize;
        this.chunkOverlap = chunkOverlap;
        this.minChunkSize = minChunkSize;
        this.respectSentenceBoundaries = respectSentenceBoundaries;
        this.respectParagraphBoundaries = respectParagraphBoundaries;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 切割文本
     *
     * @param sourceId 所属知识源
     * @param text     原始文本
     * @return 惰性序列，每次迭代都从头重新切割
     */
    public Iterable<Chunk> chunkText(String sourceId, String text) {
        return chunkText(sourceId, text, 0);
    }

    /**
     * 切割文本，chunkIndex 从 startChunkIndex 开始编号
     */
    public Iterable<Chunk> chunkText(String sourceId, String text, int startChunkIndex) {
        if (text == null || text.isBlank()) {
            return Collections.emptyList();
        }
        int[] codePoints = text.codePoints().toArray();
        return () -> new ChunkIterator(sourceId, codePoints, startChunkIndex);
    }

    /**
     * 切割并收集为列表
     */
    public List<Chunk> chunkTextToList(String sourceId, String text) {
        List<Chunk> chunks = new ArrayList<>();
        chunkText(sourceId, text).forEach(chunks::add);
        log.debug("文本已切割为 {} 个知识块: sourceId={}, 长度={}",
                chunks.size(), sourceId, text == null ? 0 : text.length());
        return chunks;
    }

    /**
     * 计算窗口结束位置（不含）
     */
    private int windowEnd(int[] codePoints, int start) {
        int hardEnd = Math.min(start + chunkSize, codePoints.length);
        if (hardEnd == codePoints.length) {
            return hardEnd;
        }

        int minEnd = start + minChunkSize;
        if (respectParagraphBoundaries) {
            int end = lastParagraphBreak(codePoints, start, minEnd, hardEnd);
            if (end > 0) {
                return end;
            }
        }
        if (respectSentenceBoundaries) {
            int end = lastSentenceEnd(codePoints, minEnd, hardEnd);
            if (end > 0) {
                return end;
            }
        }
        return hardEnd;
    }

    // 返回紧跟在 \n\n 之后的位置，找不到返回 -1
    private int lastParagraphBreak(int[] codePoints, int start, int minEnd, int hardEnd) {
        for (int end = hardEnd; end >= minEnd; end--) {
            if (end - PARAGRAPH_BREAK.length() >= start
                    && codePoints[end - 1] == '\n'
                    && codePoints[end - 2] == '\n') {
                return end;
            }
        }
        return -1;
    }

    // 句末标点后需为空白，避免切开 3.14 或 URL
    private int lastSentenceEnd(int[] codePoints, int minEnd, int hardEnd) {
        for (int end = hardEnd; end >= minEnd; end--) {
            int c = codePoints[end - 1];
            boolean terminator = c == '.' || c == '!' || c == '?';
            if (terminator && (end == codePoints.length || Character.isWhitespace(codePoints[end]))) {
                return end;
            }
        }
        return -1;
    }

    /**
     * 未设置的参数取默认值，build() 时统一校验
     */
    public static final class Builder {

        private int chunkSize = DEFAULT_CHUNK_SIZE;
        private int chunkOverlap = DEFAULT_CHUNK_OVERLAP;
        private int minChunkSize = DEFAULT_MIN_CHUNK_SIZE;
        private boolean respectSentenceBoundaries = true;
        private boolean respectParagraphBoundaries = true;

        private Builder() {
        }

        public Builder chunkSize(int chunkSize) {
            this.chunkSize = chunkSize;
            return this;
        }

        public Builder chunkOverlap(int chunkOverlap) {
            this.chunkOverlap = chunkOverlap;
            return this;
        }

        public Builder minChunkSize(int minChunkSize) {
            this.minChunkSize = minChunkSize;
            return this;
        }

        public Builder respectSentenceBoundaries(boolean respectSentenceBoundaries) {
            this.respectSentenceBoundaries = respectSentenceBoundaries;
            return this;
        }

        public Builder respectParagraphBoundaries(boolean respectParagraphBoundaries) {
            this.respectParagraphBoundaries = respectParagraphBoundaries;
            return this;
        }

        public TextChunker build() {
            return new TextChunker(chunkSize, chunkOverlap, minChunkSize,
                    respectSentenceBoundaries, respectParagraphBoundaries);
        }
    }

    private final class ChunkIterator implements Iterator<Chunk> {

        private final String sourceId;
        private final int[] codePoints;
        private int cursor;
        private int nextIndex;
        private boolean exhausted;
        private Chunk pending;

        private ChunkIterator(String sourceId, int[] codePoints, int startChunkIndex) {
            this.sourceId = sourceId;
            this.codePoints = codePoints;
            this.nextIndex = startChunkIndex;
        }

        @Override
        public boolean hasNext() {
            if (pending == null && !exhausted) {
                pending = advance();
            }
            return pending != null;
        }

        @Override
        public Chunk next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            Chunk chunk = pending;
            pending = null;
            return chunk;
        }

        // 文本中间的纯空白窗口照常输出，保证相邻块之间的重叠不断开
        private Chunk advance() {
            int start = cursor;
            int end = windowEnd(codePoints, start);
            if (end >= codePoints.length) {
                exhausted = true;
            } else {
                int next = end - chunkOverlap;
                // 回退后的窗口可能短于 overlap，此时放弃重叠以保证前进
                cursor = next > start ? next : end;
            }
            return buildChunk(start, end);
        }

        private Chunk buildChunk(int start, int end) {
            int index = nextIndex++;
            return Chunk.builder()
                    .chunkId(sourceId + "_" + index)
                    .sourceId(sourceId)
                    .text(new String(codePoints, start, end - start))
                    .chunkIndex(index)
                    .startChar(start)
                    .endChar(end)
                    .metadata(Map.of(
                            "chunk_index", index,
                            "char_start", start,
                            "char_end", end))
                    .build();
        }
    }
}
