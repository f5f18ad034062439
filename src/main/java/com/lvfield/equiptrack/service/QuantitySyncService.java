package com.lvfield.equiptrack.service;

import com.lvfield.equiptrack.model.MilestonePhase;
import com.lvfield.equiptrack.model.ProjectEquipment;

/**
 * 采购数量同步 (下单 / 到货)
 * <p>
 * 所有写操作都是累加的，重复调用会重复计数，由调用方保证"一次实际动作只调一次"。
 * 每次成功写入后都会失效该项目的里程碑缓存。
 */
public interface QuantitySyncService {

    /**
     * 到货数量 += delta；到货超过下单只提示 (overReceived)，不拦截
     */
    ProjectEquipment applyReceipt(Integer equipmentId, int delta);

    ProjectEquipment applyOrder(Integer equipmentId, int delta);

    /**
     * "全部到货"：阶段内所有合格设备的到货数量设为下单数量
     *
     * @return 实际变更的设备行数
     */
    int applyFullReceipt(Integer projectId, MilestonePhase phase);

    /**
     * 人工更正，唯一允许减少数量的入口；传 null 的字段不修改
     */
    ProjectEquipment correctQuantities(Integer equipmentId, Integer ordered, Integer received);
}
