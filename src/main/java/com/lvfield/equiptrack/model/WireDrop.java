package com.lvfield.equiptrack.model;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 线缆点位 (wire drop) 实体类，即一条布线/一个安装位置
 * 对应数据库表: wire_drop
 */
@Data
@TableName("wire_drop")
public class WireDrop {

    @TableId(type = IdType.AUTO)
    private Integer id;

    private Integer projectId;

    private String dropName;

    private String roomName;

    private LocalDateTime createdAt;
}
