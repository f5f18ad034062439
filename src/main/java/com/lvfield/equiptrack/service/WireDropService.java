package com.lvfield.equiptrack.service;

import com.lvfield.equiptrack.model.WireDropEquipmentLink;
import com.lvfield.equiptrack.model.WireDropStage;

/**
 * 点位写操作
 */
public interface WireDropService {

    /**
     * 把设备关联到点位
     * 同一 (点位, 设备, 端) 已存在时直接返回已有记录
     */
    WireDropEquipmentLink linkEquipment(Integer wireDropId, Integer equipmentId, String side, Integer sortOrder);

    /**
     * 标记点位某阶段完成 (可附照片)，会让该项目的里程碑缓存失效
     */
    WireDropStage markStageComplete(Integer wireDropId, String stageType, String photoUrl);
}
