package com.lvfield.equiptrack.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.QueryWrapper;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lvfield.equiptrack.dto.reconcile.ImportOutcome;
import com.lvfield.equiptrack.dto.reconcile.LinkRestoreFailure;
import com.lvfield.equiptrack.dto.reconcile.ParsedRow;
import com.lvfield.equiptrack.dto.reconcile.ReconciliationReport;
import com.lvfield.equiptrack.dto.reconcile.ReconciliationSnapshot;
import com.lvfield.equiptrack.dto.reconcile.SnapshotEntry;
import com.lvfield.equiptrack.exception.ReconciliationPhase;
import com.lvfield.equiptrack.exception.ReconciliationPhaseException;
import com.lvfield.equiptrack.mapper.EquipmentImportBatchMapper;
import com.lvfield.equiptrack.mapper.ProjectEquipmentMapper;
import com.lvfield.equiptrack.mapper.WireDropEquipmentLinkMapper;
import com.lvfield.equiptrack.model.EquipmentImportBatch;
import com.lvfield.equiptrack.model.ProjectEquipment;
import com.lvfield.equiptrack.model.WireDropEquipmentLink;
import com.lvfield.equiptrack.service.EquipmentReconciliationService;
import com.lvfield.equiptrack.service.LinkSnapshotStore;
import com.lvfield.equiptrack.service.MilestoneCacheService;
import com.lvfield.equiptrack.util.EquipmentKeyUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 设备清单重导入实现
 * <p>
 * 整体不开事务：阶段 2、3 各自在 EquipmentImportWriter 中原子提交，
 * 阶段 3 失败时项目里没有导入设备，抛出 ReconciliationPhaseException 让操作员重试。
 */
@Slf4j
@Service
public class EquipmentReconciliationServiceImpl implements EquipmentReconciliationService {

    @Autowired
    private LinkSnapshotStore linkSnapshotStore;

    @Autowired
    private EquipmentImportWriter importWriter;

    @Autowired
    private EquipmentImportBatchMapper batchMapper;

    @Autowired
    private ProjectEquipmentMapper equipmentMapper;

    @Autowired
    private WireDropEquipmentLinkMapper linkMapper;

    @Autowired
    private MilestoneCacheService milestoneCacheService;

    @Autowired
    private ObjectMapper objectMapper;

    @Override
    public ReconciliationReport reimport(Integer projectId, List<ParsedRow> rows) {
        return reimport(projectId, null, rows, null);
    }

    @Override
    public ReconciliationReport reimport(Integer projectId, String filename, List<ParsedRow> rows, Integer userId) {
        if (projectId == null) {
            throw new IllegalArgumentException("项目ID不能为空");
        }
        List<ParsedRow> safeRows = rows == null ? Collections.emptyList() : rows;
        log.info("[设备重导入] 项目 [{}] 开始重导入，文件: {}，共 {} 行", projectId, filename, safeRows.size());

        // 1. 抓快照 + 建批次记录 (此时还没有删除任何数据)
        ReconciliationSnapshot snapshot;
        EquipmentImportBatch batch;
        try {
            snapshot = linkSnapshotStore.capture(projectId);
            batch = createBatch(projectId, filename, safeRows.size(), userId);
        } catch (RuntimeException e) {
            log.error("[设备重导入] 项目 [{}] 抓取快照失败，已中止", projectId, e);
            throw new ReconciliationPhaseException(projectId, ReconciliationPhase.SNAPSHOT, null, e);
        }

        ReconciliationReport report = new ReconciliationReport();
        report.setProjectId(projectId);
        report.setBatchId(batch.getId());
        report.setLinksSnapshotted(snapshot.size());

        boolean deleteCommitted = false;
        try {
            // 2. 删除旧设备
            try {
                report.setDeleted(importWriter.deleteImportedEquipment(projectId));
            } catch (RuntimeException e) {
                throw failBatch(batch, ReconciliationPhase.DELETE, e);
            }
            deleteCommitted = true;

            // 3. 写入新设备
            ImportOutcome outcome;
            try {
                outcome = importWriter.insertParsedRows(projectId, batch.getId(), safeRows);
            } catch (RuntimeException e) {
                throw failBatch(batch, ReconciliationPhase.REIMPORT, e);
            }
            report.setInserted(outcome.getInserted().size());
            report.setRoomsCreated(outcome.getRoomsCreated());
            report.setPartsCreated(outcome.getPartsCreated());
            report.setLaborRowsSkipped(outcome.getLaborRowsSkipped());
            report.setSkippedRows(outcome.getSkippedRows());

            // 4. 恢复关联 (单条失败只记入报告)
            try {
                restoreLinks(snapshot, outcome.getInserted(), report);
            } catch (RuntimeException e) {
                throw failBatch(batch, ReconciliationPhase.RESTORE, e);
            }

            markProcessed(batch, report);
            log.info("[设备重导入] 项目 [{}] 完成: {}", projectId, report.summary());
            return report;
        } finally {
            // 删除一旦提交，项目数字就变了；不管后面成功与否都要失效
            if (deleteCommitted) {
                milestoneCacheService.invalidate(projectId);
            }
        }
    }

    @Override
    public List<ProjectEquipment> listEquipment(Integer projectId) {
        QueryWrapper<ProjectEquipment> query = new QueryWrapper<>();
        query.eq("project_id", projectId).orderByAsc("id");
        return equipmentMapper.selectList(query);
    }

    @Override
    public List<EquipmentImportBatch> listBatches(Integer projectId) {
        QueryWrapper<EquipmentImportBatch> query = new QueryWrapper<>();
        query.eq("project_id", projectId).orderByDesc("id");
        return batchMapper.selectList(query);
    }

    /**
     * 匹配键 → 新设备；撞键时取导入顺序中的第一个
     */
    private void restoreLinks(ReconciliationSnapshot snapshot, List<ProjectEquipment> inserted,
                              ReconciliationReport report) {
        Map<String, ProjectEquipment> byKey = new HashMap<>();
        for (ProjectEquipment item : inserted) {
            byKey.putIfAbsent(EquipmentKeyUtils.buildKey(item), item);
        }

        Set<String> restored = new HashSet<>();
        LocalDateTime now = LocalDateTime.now();
        for (SnapshotEntry entry : snapshot.getEntries()) {
            ProjectEquipment target = byKey.get(entry.getMatchKey());
            if (target == null) {
                report.getLinksFailed().add(toFailure(entry, LinkRestoreFailure.REASON_NOT_FOUND));
                continue;
            }
            String triple = entry.getWireDropId() + EquipmentKeyUtils.SEPARATOR + target.getId()
                    + EquipmentKeyUtils.SEPARATOR + entry.getLinkSide();
            if (!restored.add(triple)) {
                report.getLinksFailed().add(toFailure(entry, LinkRestoreFailure.REASON_DUPLICATE));
                continue;
            }

            WireDropEquipmentLink link = new WireDropEquipmentLink();
            link.setWireDropId(entry.getWireDropId());
            link.setProjectEquipmentId(target.getId());
            link.setLinkSide(entry.getLinkSide());
            link.setSortOrder(entry.getSortOrder());
            link.setCreatedAt(now);
            try {
                linkMapper.insert(link);
                report.setLinksRestored(report.getLinksRestored() + 1);
            } catch (DataAccessException e) {
                log.warn("[设备重导入] 点位 [{}] 关联恢复失败: {}", entry.getWireDropId(), e.getMessage());
                report.getLinksFailed().add(toFailure(entry, "保存关联失败: " + e.getMostSpecificCause().getMessage()));
            }
        }

        if (!report.getLinksFailed().isEmpty()) {
            log.warn("[设备重导入] 项目 [{}] 有 {} 条关联无法恢复，需要人工处理",
                    snapshot.getProjectId(), report.getLinksFailed().size());
        }
    }

    private static LinkRestoreFailure toFailure(SnapshotEntry entry, String reason) {
        return LinkRestoreFailure.builder()
                .wireDropId(entry.getWireDropId())
                .wireDropName(entry.getWireDropName())
                .linkSide(entry.getLinkSide())
                .sortOrder(entry.getSortOrder())
                .equipmentName(entry.getEquipmentName())
                .partNumber(entry.getPartNumber())
                .roomName(entry.getRoomName())
                .describedEquipment(entry.describeEquipment())
                .reason(reason)
                .build();
    }

    private EquipmentImportBatch createBatch(Integer projectId, String filename, int totalRows, Integer userId) {
        EquipmentImportBatch batch = new EquipmentImportBatch();
        batch.setProjectId(projectId);
        batch.setFilename(filename);
        batch.setTotalRows(totalRows);
        batch.setProcessedRows(0);
        batch.setStatus(EquipmentImportBatch.STATUS_PENDING);
        batch.setCreatedBy(userId);
        batch.setCreatedAt(LocalDateTime.now());
        batchMapper.insert(batch);
        return batch;
    }

    /**
     * 批次标记为已处理并保存报告
     * <p>
     * 此时旧关联已经删除，报告必须交回调用方：更新批次失败只记录警告，不向外抛
     */
    private void markProcessed(EquipmentImportBatch batch, ReconciliationReport report) {
        batch.setStatus(EquipmentImportBatch.STATUS_PROCESSED);
        batch.setProcessedRows(report.getInserted());
        batch.setCompletedAt(LocalDateTime.now());
        try {
            batch.setReportJson(objectMapper.writeValueAsString(report));
        } catch (JsonProcessingException e) {
            log.warn("[设备重导入] 批次 [{}] 报告序列化失败，批次记录不含报告: {}", batch.getId(), e.getMessage());
        }
        try {
            batchMapper.updateById(batch);
        } catch (RuntimeException e) {
            log.warn("[设备重导入] 批次 [{}] 状态更新失败，报告未落库；未恢复关联 {} 条: {}",
                    batch.getId(), report.getLinksFailed().size(), report.getLinksFailed(), e);
            report.setBatchRecordWarning("批次记录更新失败，导入报告未保存，请保留本次结果: " + e.getMessage());
        }
    }

    /**
     * 批次标记为失败并包装成阶段异常；标记本身失败时挂到原异常上，不覆盖原因
     */
    private ReconciliationPhaseException failBatch(EquipmentImportBatch batch, ReconciliationPhase phase,
                                                   RuntimeException cause) {
        log.error("[设备重导入] 项目 [{}] 阶段 [{}] 失败", batch.getProjectId(), phase.getLabel(), cause);
        ReconciliationPhaseException failure =
                new ReconciliationPhaseException(batch.getProjectId(), phase, batch.getId(), cause);
        try {
            batch.setStatus(EquipmentImportBatch.STATUS_FAILED);
            batch.setErrorMessage(failure.getMessage());
            batch.setCompletedAt(LocalDateTime.now());
            batchMapper.updateById(batch);
        } catch (RuntimeException updateError) {
            failure.addSuppressed(updateError);
        }
        return failure;
    }
}
