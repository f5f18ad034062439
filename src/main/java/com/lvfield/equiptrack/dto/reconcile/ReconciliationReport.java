package com.lvfield.equiptrack.dto.reconcile;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 重导入结果报告
 * 导入页面必须完整展示，尤其是 linksFailed 列表
 */
@Data
public class ReconciliationReport {

    private Integer projectId;

    private Integer batchId;

    /** 删除的旧设备行数 (只统计带批次号的) */
    private int deleted;

    private int inserted;

    private int roomsCreated;

    private int partsCreated;

    private int laborRowsSkipped;

    private List<RowIssue> skippedRows = new ArrayList<>();

    private int linksSnapshotted;

    private int linksRestored;

    private List<LinkRestoreFailure> linksFailed = new ArrayList<>();

    /** 批次记录未能更新时的说明；此时本报告是 linksFailed 的唯一副本 */
    private String batchRecordWarning;

    /**
     * 给导入页面的一句话摘要
     */
    public String summary() {
        StringBuilder sb = new StringBuilder();
        sb.append("导入设备 ").append(inserted).append(" 件，新建房间 ").append(roomsCreated).append(" 个；");
        sb.append("已恢复 ").append(linksRestored).append(" 条关联");
        if (!linksFailed.isEmpty()) {
            sb.append("，").append(linksFailed.size()).append(" 条无法匹配: ");
            sb.append(linksFailed.stream()
                    .map(LinkRestoreFailure::getDescribedEquipment)
                    .collect(Collectors.joining("; ")));
        }
        if (!skippedRows.isEmpty()) {
            sb.append("；跳过非法行 ").append(skippedRows.size()).append(" 行");
        }
        return sb.toString();
    }
}
