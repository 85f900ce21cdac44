package com.alibaba.cloud.ai.knowledge.domain.vo;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.nio.file.Path;

/**
 * 检索命中结果，由存储后端的相似度检索产生
 *
 * @author RobustH
 */
@Value
@Builder
public class SearchHit {

    @NonNull
    Chunk chunk;

    @NonNull
    String text;

    /**
     * 相似度得分，范围 [0, 1]
     */
    double similarityScore;

    /**
     * 排名，从 1 开始
     */
    int rank;

    @NonNull
    Path sourcePath;

    /**
     * 源文件 MIME 类型
     */
    @NonNull
    String sourceType;

    /**
     * 由命中的知识块及其所属知识源构造
     */
    public static SearchHit of(Chunk chunk, Source source, double similarityScore, int rank) {
        return SearchHit.builder()
                .chunk(chunk)
                .text(chunk.getText())
                .similarityScore(similarityScore)
                .rank(rank)
                .sourcePath(source.getPath())
                .sourceType(source.getMimeType())
                .build();
    }
}
