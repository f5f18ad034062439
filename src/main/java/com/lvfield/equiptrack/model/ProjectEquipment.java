package com.lvfield.equiptrack.model;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 项目设备实体类
 * 对应数据库表: project_equipment
 * 一行 = 项目里的一件设备 (或一组设备中的一个实例)
 */
@Data
@TableName("project_equipment")
public class ProjectEquipment {

    /**
     * 每次整表重导入都会重新生成，不能当作稳定标识
     */
    @TableId(type = IdType.AUTO)
    private Integer id;

    private Integer projectId;

    /**
     * 关联的全局物料ID (可为空)
     */
    private Integer globalPartId;

    /**
     * 外部料号 (方案书里的 Part Number)，可为空
     */
    private String partNumber;

    /**
     * 显示名称；批量展开的实例会带上 " #n" 后缀
     */
    private String name;

    private String description;

    private String manufacturer;

    private String model;

    /**
     * 所在房间ID (可为空)
     */
    private Integer roomId;

    /**
     * 安装端: room_end / head_end / unspecified
     * @see InstallSide
     */
    private String installSide;

    // --- 数量 ---

    private Integer plannedQuantity;

    private Integer orderedQuantity;

    private Integer receivedQuantity;

    private BigDecimal unitCost;

    private String supplier;

    /**
     * 产生这一行的导入批次ID
     * 为空表示手工录入，重导入永远不会删除这类设备
     */
    private Integer importBatchId;

    /**
     * 同一行展开出来的多个实例共享同一个分组ID
     */
    private String instanceGroupId;

    private Integer instanceNumber;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    /**
     * 到货数量超过下单数量 (软约束，只提示不拦截)
     */
    @TableField(exist = false)
    private boolean overReceived;

    public boolean isBatchTagged() {
        return importBatchId != null;
    }

    public int orderedOrZero() {
        return orderedQuantity == null ? 0 : orderedQuantity;
    }

    public int receivedOrZero() {
        return receivedQuantity == null ? 0 : receivedQuantity;
    }

    public int plannedOrZero() {
        return plannedQuantity == null ? 0 : plannedQuantity;
    }
}
