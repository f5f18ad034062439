package com.lvfield.equiptrack.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.lvfield.equiptrack.model.SiteProject;
import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface SiteProjectMapper extends BaseMapper<SiteProject> {
}
