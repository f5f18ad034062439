package com.lvfield.equiptrack.service;

import com.lvfield.equiptrack.dto.reconcile.ParsedRow;
import com.lvfield.equiptrack.dto.reconcile.ReconciliationReport;
import com.lvfield.equiptrack.model.EquipmentImportBatch;
import com.lvfield.equiptrack.model.ProjectEquipment;

import java.util.List;

/**
 * 设备清单重导入
 * <p>
 * 四个阶段严格按顺序执行：抓快照 → 删旧设备 → 写新设备 → 恢复关联。
 * 同一项目的两次重导入不能并发，由调用方保证 (例如导入进行中禁用导入按钮)。
 */
public interface EquipmentReconciliationService {

    /**
     * @param filename 原始文件名，只写入批次记录
     * @param userId   操作人，可为空
     * @throws com.lvfield.equiptrack.exception.ReconciliationPhaseException 某阶段的存储操作失败
     */
    ReconciliationReport reimport(Integer projectId, String filename, List<ParsedRow> rows, Integer userId);

    ReconciliationReport reimport(Integer projectId, List<ParsedRow> rows);

    List<ProjectEquipment> listEquipment(Integer projectId);

    List<EquipmentImportBatch> listBatches(Integer projectId);
}
