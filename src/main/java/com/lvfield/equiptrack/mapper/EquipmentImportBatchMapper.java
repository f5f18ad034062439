package com.lvfield.equiptrack.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.lvfield.equiptrack.model.EquipmentImportBatch;
import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface EquipmentImportBatchMapper extends BaseMapper<EquipmentImportBatch> {
}
