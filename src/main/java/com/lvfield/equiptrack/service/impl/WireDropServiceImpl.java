package com.lvfield.equiptrack.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.QueryWrapper;
import com.lvfield.equiptrack.mapper.ProjectEquipmentMapper;
import com.lvfield.equiptrack.mapper.WireDropEquipmentLinkMapper;
import com.lvfield.equiptrack.mapper.WireDropMapper;
import com.lvfield.equiptrack.mapper.WireDropStageMapper;
import com.lvfield.equiptrack.model.InstallSide;
import com.lvfield.equiptrack.model.ProjectEquipment;
import com.lvfield.equiptrack.model.StageType;
import com.lvfield.equiptrack.model.WireDrop;
import com.lvfield.equiptrack.model.WireDropEquipmentLink;
import com.lvfield.equiptrack.model.WireDropStage;
import com.lvfield.equiptrack.service.MilestoneCacheService;
import com.lvfield.equiptrack.service.WireDropService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;

@Slf4j
@Service
public class WireDropServiceImpl implements WireDropService {

    @Autowired
    private WireDropMapper wireDropMapper;

    @Autowired
    private WireDropStageMapper wireDropStageMapper;

    @Autowired
    private WireDropEquipmentLinkMapper linkMapper;

    @Autowired
    private ProjectEquipmentMapper equipmentMapper;

    @Autowired
    private MilestoneCacheService milestoneCacheService;

    @Override
    public WireDropEquipmentLink linkEquipment(Integer wireDropId, Integer equipmentId, String side, Integer sortOrder) {
        WireDrop drop = requireDrop(wireDropId);
        ProjectEquipment equipment = equipmentMapper.selectById(equipmentId);
        if (equipment == null) {
            throw new IllegalArgumentException("设备不存在: " + equipmentId);
        }
        if (!drop.getProjectId().equals(equipment.getProjectId())) {
            throw new IllegalArgumentException("点位和设备不属于同一个项目");
        }

        InstallSide linkSide = InstallSide.fromCode(side);
        if (linkSide == InstallSide.UNSPECIFIED) {
            throw new IllegalArgumentException("关联端只能是 room_end 或 head_end: " + side);
        }

        QueryWrapper<WireDropEquipmentLink> query = new QueryWrapper<>();
        query.eq("wire_drop_id", wireDropId)
                .eq("project_equipment_id", equipmentId)
                .eq("link_side", linkSide.getCode());
        WireDropEquipmentLink existing = linkMapper.selectOne(query);
        if (existing != null) {
            return existing;
        }

        WireDropEquipmentLink link = new WireDropEquipmentLink();
        link.setWireDropId(wireDropId);
        link.setProjectEquipmentId(equipmentId);
        link.setLinkSide(linkSide.getCode());
        link.setSortOrder(sortOrder == null ? 0 : sortOrder);
        link.setCreatedAt(LocalDateTime.now());
        linkMapper.insert(link);
        return link;
    }

    @Override
    public WireDropStage markStageComplete(Integer wireDropId, String stageType, String photoUrl) {
        WireDrop drop = requireDrop(wireDropId);
        StageType type = StageType.fromCode(stageType);

        // 1. (wire_drop_id, stage_type) 唯一：存在则更新，不存在则新建
        QueryWrapper<WireDropStage> query = new QueryWrapper<>();
        query.eq("wire_drop_id", wireDropId).eq("stage_type", type.getCode());
        WireDropStage stage = wireDropStageMapper.selectOne(query);

        if (stage == null) {
            stage = new WireDropStage();
            stage.setWireDropId(wireDropId);
            stage.setStageType(type.getCode());
            stage.setCompleted(true);
            stage.setPhotoUrl(photoUrl);
            stage.setCompletedAt(LocalDateTime.now());
            wireDropStageMapper.insert(stage);
        } else {
            stage.setCompleted(true);
            if (photoUrl != null) {
                stage.setPhotoUrl(photoUrl);
            }
            stage.setCompletedAt(LocalDateTime.now());
            wireDropStageMapper.updateById(stage);
        }

        // 2. 施工阶段变化会影响进度，立即失效缓存
        milestoneCacheService.invalidate(drop.getProjectId());
        log.info("[点位] 点位 [{}] 阶段 {} 已完成", drop.getDropName(), type.getCode());
        return stage;
    }

    private WireDrop requireDrop(Integer wireDropId) {
        WireDrop drop = wireDropMapper.selectById(wireDropId);
        if (drop == null) {
            throw new IllegalArgumentException("点位不存在: " + wireDropId);
        }
        return drop;
    }
}
