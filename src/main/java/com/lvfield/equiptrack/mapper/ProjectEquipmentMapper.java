package com.lvfield.equiptrack.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.lvfield.equiptrack.model.ProjectEquipment;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Update;

/**
 * ProjectEquipment 表的数据访问接口 (Mapper)
 * 数量累加用单条 UPDATE 完成，避免"先读后写"丢失并发的到货记录
 */
@Mapper
public interface ProjectEquipmentMapper extends BaseMapper<ProjectEquipment> {

    @Update("UPDATE project_equipment SET received_quantity = COALESCE(received_quantity, 0) + #{delta}, " +
            "updated_at = CURRENT_TIMESTAMP WHERE id = #{id}")
    int addReceived(@Param("id") Integer id, @Param("delta") int delta);

    @Update("UPDATE project_equipment SET ordered_quantity = COALESCE(ordered_quantity, 0) + #{delta}, " +
            "updated_at = CURRENT_TIMESTAMP WHERE id = #{id}")
    int addOrdered(@Param("id") Integer id, @Param("delta") int delta);
}
