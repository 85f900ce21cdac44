package com.alibaba.cloud.ai.knowledge.store.mapper;

import com.alibaba.cloud.ai.knowledge.store.domain.entity.SourceEntity;
import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

@Mapper
public interface SourceMapper extends BaseMapper<SourceEntity> {

    @Select("SELECT source_id FROM knowledge_source")
    List<String> selectAllSourceIds();

    @Select("SELECT sha256_hash FROM knowledge_source WHERE source_id = #{sourceId}")
    String selectHashById(@Param("sourceId") String sourceId);
}
