package com.lvfield.equiptrack.service.impl;

import com.lvfield.equiptrack.dto.reconcile.ReconciliationSnapshot;
import com.lvfield.equiptrack.dto.reconcile.SnapshotEntry;
import com.lvfield.equiptrack.mapper.ProjectEquipmentMapper;
import com.lvfield.equiptrack.mapper.ProjectRoomMapper;
import com.lvfield.equiptrack.model.ProjectEquipment;
import com.lvfield.equiptrack.model.ProjectRoom;
import com.lvfield.equiptrack.model.WireDrop;
import com.lvfield.equiptrack.model.WireDropEquipmentLink;
import com.lvfield.equiptrack.service.InstallationRecordService;
import com.lvfield.equiptrack.service.LinkSnapshotStore;
import com.lvfield.equiptrack.util.EquipmentKeyUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

@Slf4j
@Service
public class LinkSnapshotStoreImpl implements LinkSnapshotStore {

    @Autowired
    private InstallationRecordService installationRecordService;

    @Autowired
    private ProjectEquipmentMapper equipmentMapper;

    @Autowired
    private ProjectRoomMapper roomMapper;

    @Override
    public ReconciliationSnapshot capture(Integer projectId) {
        List<WireDropEquipmentLink> links = installationRecordService.listLinks(projectId);
        if (links.isEmpty()) {
            return new ReconciliationSnapshot(projectId, Collections.emptyList());
        }

        // 1. 关联指向的旧设备，只保留带批次号的
        Set<Integer> equipmentIds = links.stream()
                .map(WireDropEquipmentLink::getProjectEquipmentId)
                .collect(Collectors.toSet());
        Map<Integer, ProjectEquipment> equipmentById = equipmentMapper.selectBatchIds(equipmentIds).stream()
                .filter(ProjectEquipment::isBatchTagged)
                .collect(Collectors.toMap(ProjectEquipment::getId, Function.identity()));

        // 2. 房间名、点位名只用于失败报告
        Set<Integer> roomIds = equipmentById.values().stream()
                .map(ProjectEquipment::getRoomId)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());
        Map<Integer, String> roomNames = roomIds.isEmpty() ? Collections.emptyMap()
                : roomMapper.selectBatchIds(roomIds).stream()
                .filter(room -> room.getName() != null)
                .collect(Collectors.toMap(ProjectRoom::getId, ProjectRoom::getName));
        Map<Integer, WireDrop> drops = installationRecordService.getWireDrops(links.stream()
                .map(WireDropEquipmentLink::getWireDropId)
                .collect(Collectors.toSet()));

        // 3. 用旧设备行算匹配键
        List<SnapshotEntry> entries = new ArrayList<>();
        for (WireDropEquipmentLink link : links) {
            ProjectEquipment equipment = equipmentById.get(link.getProjectEquipmentId());
            if (equipment == null) {
                continue;
            }
            WireDrop drop = drops.get(link.getWireDropId());
            entries.add(SnapshotEntry.builder()
                    .wireDropId(link.getWireDropId())
                    .wireDropName(drop == null ? null : drop.getDropName())
                    .linkSide(link.getLinkSide())
                    .sortOrder(link.getSortOrder())
                    .matchKey(EquipmentKeyUtils.buildKey(equipment))
                    .oldEquipmentId(equipment.getId())
                    .equipmentName(equipment.getName())
                    .partNumber(equipment.getPartNumber())
                    .roomName(roomNames.get(equipment.getRoomId()))
                    .build());
        }
        log.info("[设备重导入] 项目 [{}] 关联快照: 共 {} 条关联，其中 {} 条指向导入设备", projectId, links.size(), entries.size());
        return new ReconciliationSnapshot(projectId, entries);
    }
}
