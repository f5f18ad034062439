package com.lvfield.equiptrack.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.lvfield.equiptrack.model.ProjectRoom;
import org.apache.ibatis.annotations.Mapper;

/**
 * ProjectRoom 表的数据访问接口
 * 继承 BaseMapper 后自动拥有基础的 CRUD 能力
 */
@Mapper
public interface ProjectRoomMapper extends BaseMapper<ProjectRoom> {
}
