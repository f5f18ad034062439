package com.lvfield.equiptrack.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.lvfield.equiptrack.model.GlobalPart;
import org.apache.ibatis.annotations.Mapper;

/**
 * 全局物料目录 Mapper
 */
@Mapper
public interface GlobalPartMapper extends BaseMapper<GlobalPart> {
}
