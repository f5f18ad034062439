package com.lvfield.equiptrack.model;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 点位-设备关联
 * 对应数据库表: wire_drop_equipment_link
 * (wire_drop_id, project_equipment_id, link_side) 唯一；设备被删除时级联删除
 */
@Data
@TableName("wire_drop_equipment_link")
public class WireDropEquipmentLink {

    @TableId(type = IdType.AUTO)
    private Integer id;

    private Integer wireDropId;

    private Integer projectEquipmentId;

    /** room_end / head_end */
    private String linkSide;

    private Integer sortOrder;

    private LocalDateTime createdAt;
}
