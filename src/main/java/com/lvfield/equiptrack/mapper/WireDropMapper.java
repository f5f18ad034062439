package com.lvfield.equiptrack.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.lvfield.equiptrack.model.WireDrop;
import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface WireDropMapper extends BaseMapper<WireDrop> {
}
