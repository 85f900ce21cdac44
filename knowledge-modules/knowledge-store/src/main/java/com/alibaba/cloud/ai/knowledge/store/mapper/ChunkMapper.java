package com.alibaba.cloud.ai.knowledge.store.mapper;

import com.alibaba.cloud.ai.knowledge.store.domain.entity.ChunkEntity;
import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

/**
 * 知识块 Mapper
 */
@Mapper
public interface ChunkMapper extends BaseMapper<ChunkEntity> {

    /**
     * 批量插入知识块（单条 SQL，一个文件的知识块一次写入）
     */
    @Insert({"<script>",
            "INSERT INTO knowledge_chunk (chunk_id, source_id, content, chunk_index, start_char, end_char,",
            " metadata, embedding, embedding_model, embedded_at, embedding_dimensions) VALUES ",
            "<foreach collection='list' item='c' separator=','>",
            "(#{c.chunkId}, #{c.sourceId}, #{c.content}, #{c.chunkIndex}, #{c.startChar}, #{c.endChar},",
            " #{c.metadata}, #{c.embedding}, #{c.embeddingModel}, #{c.embeddedAt}, #{c.embeddingDimensions})",
            "</foreach>",
            "</script>"})
    int batchInsert(@Param("list") List<ChunkEntity> chunks);

    /**
     * 删除某个知识源的全部知识块（文件更新/删除时调用）
     */
    @Delete("DELETE FROM knowledge_chunk WHERE source_id = #{sourceId}")
    int deleteBySourceId(@Param("sourceId") String sourceId);

    @Select("SELECT COUNT(*) FROM knowledge_chunk WHERE embedding IS NOT NULL")
    long countEmbedded();
}
