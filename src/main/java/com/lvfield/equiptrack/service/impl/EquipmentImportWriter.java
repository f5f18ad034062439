package com.lvfield.equiptrack.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.QueryWrapper;
import com.lvfield.equiptrack.dto.reconcile.ImportOutcome;
import com.lvfield.equiptrack.dto.reconcile.ParsedRow;
import com.lvfield.equiptrack.dto.reconcile.ResolvedIndex;
import com.lvfield.equiptrack.dto.reconcile.RowIssue;
import com.lvfield.equiptrack.mapper.ProjectEquipmentMapper;
import com.lvfield.equiptrack.mapper.WireDropEquipmentLinkMapper;
import com.lvfield.equiptrack.model.GlobalPart;
import com.lvfield.equiptrack.model.InstallSide;
import com.lvfield.equiptrack.model.ProjectEquipment;
import com.lvfield.equiptrack.model.ProjectRoom;
import com.lvfield.equiptrack.model.WireDropEquipmentLink;
import com.lvfield.equiptrack.service.GlobalPartService;
import com.lvfield.equiptrack.service.RoomService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * 重导入的两个破坏性阶段，各自一个事务
 * 单独成 Bean，保证从 EquipmentReconciliationServiceImpl 调用时 @Transactional 经过代理生效
 */
@Slf4j
@Component
public class EquipmentImportWriter {

    @Autowired
    private ProjectEquipmentMapper equipmentMapper;

    @Autowired
    private WireDropEquipmentLinkMapper linkMapper;

    @Autowired
    private RoomService roomService;

    @Autowired
    private GlobalPartService globalPartService;

    /**
     * 阶段 2：删除项目内所有带批次号的设备及其关联 (覆盖模式)
     * 手工录入 (import_batch_id 为空) 的设备不动
     *
     * @return 删除的设备行数
     */
    @Transactional(rollbackFor = Exception.class)
    public int deleteImportedEquipment(Integer projectId) {
        QueryWrapper<ProjectEquipment> query = new QueryWrapper<>();
        query.select("id").eq("project_id", projectId).isNotNull("import_batch_id");
        List<Integer> ids = equipmentMapper.selectList(query).stream()
                .map(ProjectEquipment::getId)
                .collect(Collectors.toList());
        if (ids.isEmpty()) {
            return 0;
        }

        // 外键有级联，这里显式删除，不依赖具体库的约束配置
        QueryWrapper<WireDropEquipmentLink> linkQuery = new QueryWrapper<>();
        linkQuery.in("project_equipment_id", ids);
        int links = linkMapper.delete(linkQuery);

        int deleted = equipmentMapper.deleteBatchIds(ids);
        log.info("[设备重导入] 项目 [{}] 删除旧设备 {} 件、关联 {} 条", projectId, deleted, links);
        return deleted;
    }

    /**
     * 阶段 3：校验、建房间、同步物料目录、按数量展开，然后按导入顺序写入
     */
    @Transactional(rollbackFor = Exception.class)
    public ImportOutcome insertParsedRows(Integer projectId, Integer batchId, List<ParsedRow> rows) {
        ImportOutcome outcome = new ImportOutcome();

        // 1. 校验：人工费行跳过，缺名称/缺数量的行记录下来
        List<ParsedRow> valid = new ArrayList<>();
        for (int i = 0; i < rows.size(); i++) {
            ParsedRow row = rows.get(i);
            int rowNumber = i + 1;
            if (row == null) {
                outcome.getSkippedRows().add(new RowIssue(rowNumber, null, "空行"));
                continue;
            }
            if (row.isLabor()) {
                outcome.setLaborRowsSkipped(outcome.getLaborRowsSkipped() + 1);
                continue;
            }
            if (row.getName() == null || row.getName().isBlank()) {
                outcome.getSkippedRows().add(new RowIssue(rowNumber, row.getName(), "缺少设备名称"));
                continue;
            }
            if (row.getQuantity() == null || row.getQuantity() <= 0) {
                outcome.getSkippedRows().add(new RowIssue(rowNumber, row.getName(), "数量缺失或不大于 0"));
                continue;
            }
            valid.add(row);
        }

        // 2. 房间、物料目录
        ResolvedIndex<ProjectRoom> rooms = roomService.ensureRooms(projectId,
                valid.stream().map(ParsedRow::getRoomName).collect(Collectors.toList()));
        ResolvedIndex<GlobalPart> parts = globalPartService.syncParts(valid);
        outcome.setRoomsCreated(rooms.getCreated());
        outcome.setPartsCreated(parts.getCreated());

        // 3. 展开并写入
        LocalDateTime now = LocalDateTime.now();
        for (ParsedRow row : valid) {
            ProjectRoom room = rooms.find(row.getRoomName());
            GlobalPart part = parts.find(row.getCatalogPartId());
            String name = row.getName().trim();
            int quantity = row.getQuantity();

            if (quantity == 1) {
                ProjectEquipment item = buildItem(projectId, batchId, row, room, part, name, now);
                equipmentMapper.insert(item);
                outcome.getInserted().add(item);
                continue;
            }
            String groupId = UUID.randomUUID().toString();
            for (int n = 1; n <= quantity; n++) {
                ProjectEquipment item = buildItem(projectId, batchId, row, room, part, name + " #" + n, now);
                item.setInstanceGroupId(groupId);
                item.setInstanceNumber(n);
                equipmentMapper.insert(item);
                outcome.getInserted().add(item);
            }
        }

        log.info("[设备重导入] 项目 [{}] 批次 [{}] 写入设备 {} 件 (有效行 {}，跳过 {}，人工费 {})",
                projectId, batchId, outcome.getInserted().size(), valid.size(),
                outcome.getSkippedRows().size(), outcome.getLaborRowsSkipped());
        return outcome;
    }

    private ProjectEquipment buildItem(Integer projectId, Integer batchId, ParsedRow row,
                                       ProjectRoom room, GlobalPart part, String name, LocalDateTime now) {
        ProjectEquipment item = new ProjectEquipment();
        item.setProjectId(projectId);
        item.setImportBatchId(batchId);
        item.setGlobalPartId(part == null ? null : part.getId());
        item.setPartNumber(blankToNull(row.getCatalogPartId()));
        item.setName(name);
        item.setDescription(row.getDescription());
        item.setManufacturer(row.getManufacturer());
        item.setModel(row.getModel());
        item.setRoomId(room == null ? null : room.getId());
        item.setInstallSide(resolveSide(row.getInstallationSide(), room).getCode());
        item.setPlannedQuantity(1);
        item.setOrderedQuantity(0);
        item.setReceivedQuantity(0);
        item.setUnitCost(row.getUnitCost());
        item.setSupplier(blankToNull(row.getSupplierName()));
        item.setCreatedAt(now);
        item.setUpdatedAt(now);
        return item;
    }

    /**
     * 行上明确写了安装端就用它；否则机房 = head_end，其他房间 = room_end，没有房间 = unspecified
     */
    static InstallSide resolveSide(String explicitSide, ProjectRoom room) {
        InstallSide side = InstallSide.fromCode(explicitSide);
        if (side != InstallSide.UNSPECIFIED) {
            return side;
        }
        if (room == null) {
            return InstallSide.UNSPECIFIED;
        }
        return Boolean.TRUE.equals(room.getIsHeadend()) ? InstallSide.HEAD_END : InstallSide.ROOM_END;
    }

    private static String blankToNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }
}
