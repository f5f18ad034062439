package com.lvfield.equiptrack.model;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 全局物料目录实体类
 * 对应数据库表: global_part
 * 所有项目共享，按料号 (part_number，不区分大小写) 唯一
 */
@Data
@TableName("global_part")
public class GlobalPart {

    @TableId(type = IdType.AUTO)
    private Integer id;

    /**
     * 外部料号，例如 "CAT6-1000-BL"
     */
    private String partNumber;

    private String name;

    private String manufacturer;

    private String model;

    /**
     * 是否属于预布线 (prewire) 阶段的物料
     * 由目录维护，导入时不会覆盖
     */
    private Boolean requiredForPrewire;

    private LocalDateTime createdAt;
}
