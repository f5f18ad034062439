package com.lvfield.equiptrack.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.lvfield.equiptrack.model.WireDropEquipmentLink;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

@Mapper
public interface WireDropEquipmentLinkMapper extends BaseMapper<WireDropEquipmentLink> {

    /**
     * 查询某项目下所有指向设备的关联
     * 关联表本身没有 project_id，通过设备表过滤
     */
    @Select("SELECT l.* FROM wire_drop_equipment_link l " +
            "JOIN project_equipment e ON l.project_equipment_id = e.id " +
            "WHERE e.project_id = #{projectId} ORDER BY l.id")
    List<WireDropEquipmentLink> selectByProjectId(@Param("projectId") Integer projectId);
}
