package com.lvfield.equiptrack.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.lvfield.equiptrack.model.WireDropStage;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

/**
 * 点位阶段 Mapper
 */
@Mapper
public interface WireDropStageMapper extends BaseMapper<WireDropStage> {

    /**
     * 面板专用：某项目所有点位的阶段记录
     */
    @Select("SELECT s.* FROM wire_drop_stage s " +
            "JOIN wire_drop d ON s.wire_drop_id = d.id " +
            "WHERE d.project_id = #{projectId}")
    List<WireDropStage> selectByProjectId(@Param("projectId") Integer projectId);
}
