package com.lvfield.equiptrack.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.QueryWrapper;
import com.baomidou.mybatisplus.core.conditions.update.UpdateWrapper;
import com.lvfield.equiptrack.mapper.GlobalPartMapper;
import com.lvfield.equiptrack.mapper.ProjectEquipmentMapper;
import com.lvfield.equiptrack.model.GlobalPart;
import com.lvfield.equiptrack.model.MilestonePhase;
import com.lvfield.equiptrack.model.ProjectEquipment;
import com.lvfield.equiptrack.service.MilestoneCacheService;
import com.lvfield.equiptrack.service.QuantitySyncService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

@Slf4j
@Service
public class QuantitySyncServiceImpl implements QuantitySyncService {

    @Autowired
    private ProjectEquipmentMapper equipmentMapper;

    @Autowired
    private GlobalPartMapper globalPartMapper;

    @Autowired
    private MilestoneCacheService milestoneCacheService;

    @Override
    public ProjectEquipment applyReceipt(Integer equipmentId, int delta) {
        requireNonNegative(delta, "到货");
        ProjectEquipment before = requireEquipment(equipmentId);
        if (delta > 0) {
            equipmentMapper.addReceived(equipmentId, delta);
        }
        ProjectEquipment after = reload(equipmentId);
        log.info("[采购同步] 设备 [{}] 到货 +{}，当前 {}/{}", equipmentId, delta,
                after.receivedOrZero(), after.orderedOrZero());
        milestoneCacheService.invalidate(before.getProjectId());
        return after;
    }

    @Override
    public ProjectEquipment applyOrder(Integer equipmentId, int delta) {
        requireNonNegative(delta, "下单");
        ProjectEquipment before = requireEquipment(equipmentId);
        if (delta > 0) {
            equipmentMapper.addOrdered(equipmentId, delta);
        }
        ProjectEquipment after = reload(equipmentId);
        log.info("[采购同步] 设备 [{}] 下单 +{}，当前下单 {}", equipmentId, delta, after.orderedOrZero());
        milestoneCacheService.invalidate(before.getProjectId());
        return after;
    }

    @Override
    public int applyFullReceipt(Integer projectId, MilestonePhase phase) {
        if (projectId == null || phase == null) {
            throw new IllegalArgumentException("项目ID和阶段不能为空");
        }

        // 1. 找出阶段内还没到齐的合格设备
        QueryWrapper<ProjectEquipment> query = new QueryWrapper<>();
        query.eq("project_id", projectId);
        List<ProjectEquipment> equipment = equipmentMapper.selectList(query);
        Map<Integer, GlobalPart> parts = loadParts(equipment);
        List<Integer> ids = equipment.stream()
                .filter(item -> phase.isEligible(item, parts.get(item.getGlobalPartId())))
                .filter(item -> item.receivedOrZero() < item.orderedOrZero())
                .map(ProjectEquipment::getId)
                .collect(Collectors.toList());
        if (ids.isEmpty()) {
            log.info("[采购同步] 项目 [{}] {} 阶段没有需要补齐到货的设备", projectId, phase);
            return 0;
        }

        // 2. 一条 UPDATE 补齐
        UpdateWrapper<ProjectEquipment> update = new UpdateWrapper<>();
        update.in("id", ids)
                .setSql("received_quantity = ordered_quantity")
                .setSql("updated_at = CURRENT_TIMESTAMP");
        int changed = equipmentMapper.update(null, update);
        log.info("[采购同步] 项目 [{}] {} 阶段全部到货，更新 {} 件设备", projectId, phase, changed);
        milestoneCacheService.invalidate(projectId);
        return changed;
    }

    @Override
    public ProjectEquipment correctQuantities(Integer equipmentId, Integer ordered, Integer received) {
        if ((ordered != null && ordered < 0) || (received != null && received < 0)) {
            throw new IllegalArgumentException("数量不能为负数");
        }
        ProjectEquipment before = requireEquipment(equipmentId);
        if (ordered != null || received != null) {
            UpdateWrapper<ProjectEquipment> update = new UpdateWrapper<>();
            update.eq("id", equipmentId);
            if (ordered != null) {
                update.set("ordered_quantity", ordered);
            }
            if (received != null) {
                update.set("received_quantity", received);
            }
            update.setSql("updated_at = CURRENT_TIMESTAMP");
            equipmentMapper.update(null, update);
        }
        ProjectEquipment after = reload(equipmentId);
        log.info("[采购同步] 设备 [{}] 人工更正: 下单 {} → {}，到货 {} → {}", equipmentId,
                before.orderedOrZero(), after.orderedOrZero(), before.receivedOrZero(), after.receivedOrZero());
        milestoneCacheService.invalidate(before.getProjectId());
        return after;
    }

    private ProjectEquipment requireEquipment(Integer equipmentId) {
        ProjectEquipment item = equipmentId == null ? null : equipmentMapper.selectById(equipmentId);
        if (item == null) {
            throw new IllegalArgumentException("设备不存在: " + equipmentId);
        }
        return item;
    }

    /**
     * 重新读取并标记是否超收
     */
    private ProjectEquipment reload(Integer equipmentId) {
        ProjectEquipment item = requireEquipment(equipmentId);
        boolean overReceived = item.receivedOrZero() > item.orderedOrZero();
        item.setOverReceived(overReceived);
        if (overReceived) {
            log.warn("[采购同步] 设备 [{}] {} 到货 {} 超过下单 {}", item.getId(), item.getName(),
                    item.receivedOrZero(), item.orderedOrZero());
        }
        return item;
    }

    private Map<Integer, GlobalPart> loadParts(List<ProjectEquipment> equipment) {
        Set<Integer> partIds = equipment.stream()
                .map(ProjectEquipment::getGlobalPartId)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());
        if (partIds.isEmpty()) {
            return Collections.emptyMap();
        }
        return globalPartMapper.selectBatchIds(partIds).stream()
                .collect(Collectors.toMap(GlobalPart::getId, Function.identity()));
    }

    private static void requireNonNegative(int delta, String action) {
        if (delta < 0) {
            throw new IllegalArgumentException(action + "数量不能为负数，减少数量请使用人工更正: " + delta);
        }
    }
}
