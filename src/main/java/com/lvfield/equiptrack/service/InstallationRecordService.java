package com.lvfield.equiptrack.service;

import com.lvfield.equiptrack.dto.milestone.StageCompletion;
import com.lvfield.equiptrack.model.WireDrop;
import com.lvfield.equiptrack.model.WireDropEquipmentLink;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * 点位 (wire drop) 数据的只读接口
 * 重导入抓快照、里程碑计算都只通过这里读点位数据
 */
public interface InstallationRecordService {

    /**
     * 某项目下所有指向设备的关联
     */
    List<WireDropEquipmentLink> listLinks(Integer projectId);

    /**
     * 某项目点位总数和各阶段完成数
     */
    StageCompletion getStageCompletion(Integer projectId);

    Map<Integer, WireDrop> getWireDrops(Collection<Integer> wireDropIds);
}
