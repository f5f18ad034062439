package com.lvfield.equiptrack.model;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 点位施工阶段记录
 * 对应数据库表: wire_drop_stage，(wire_drop_id, stage_type) 唯一
 */
@Data
@TableName("wire_drop_stage")
public class WireDropStage {

    @TableId(type = IdType.AUTO)
    private Integer id;

    private Integer wireDropId;

    /** prewire / trim_out / commission */
    private String stageType;

    private Boolean completed;

    /**
     * 现场照片地址；有照片也视为该阶段已完成
     */
    private String photoUrl;

    private LocalDateTime completedAt;

    public boolean isDone() {
        return Boolean.TRUE.equals(completed) || (photoUrl != null && !photoUrl.isBlank());
    }
}
