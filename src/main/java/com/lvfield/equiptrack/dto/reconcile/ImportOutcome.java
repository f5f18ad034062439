package com.lvfield.equiptrack.dto.reconcile;

import com.lvfield.equiptrack.model.ProjectEquipment;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 写入新设备阶段的结果
 * inserted 保持导入顺序，恢复关联时"撞键取第一个"依赖这个顺序
 */
@Data
public class ImportOutcome {

    private List<ProjectEquipment> inserted = new ArrayList<>();

    private int roomsCreated;

    private int partsCreated;

    private int laborRowsSkipped;

    private List<RowIssue> skippedRows = new ArrayList<>();
}
