package com.lvfield.equiptrack.model;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 设备导入批次记录
 * 对应数据库表: equipment_import_batch
 * 每次重导入一条，主键即设备行上的 import_batch_id
 */
@Data
@TableName("equipment_import_batch")
public class EquipmentImportBatch {

    @TableId(type = IdType.AUTO)
    private Integer id;

    private Integer projectId;

    private String filename;

    private Integer totalRows;

    private Integer processedRows;

    /** pending / processed / failed */
    private String status;

    /**
     * 导入报告 (JSON字符串)，供之后回看"哪些关联没能恢复"
     */
    private String reportJson;

    private String errorMessage;

    private Integer createdBy;

    private LocalDateTime createdAt;

    private LocalDateTime completedAt;

    // 常量定义，防止手写字符串出错
    public static final String STATUS_PENDING = "pending";
    public static final String STATUS_PROCESSED = "processed";
    public static final String STATUS_FAILED = "failed";
}
