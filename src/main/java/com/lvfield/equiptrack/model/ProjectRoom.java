package com.lvfield.equiptrack.model;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 房间实体类
 * 对应数据库中的 `project_room` 表
 * 重导入时按名称查找，找不到就新建；重导入永远不会删除房间，所以房间ID在多次导入之间是稳定的
 */
@Data
@TableName("project_room")
public class ProjectRoom {

    /**
     * 房间ID (自增主键)
     */
    @TableId(type = IdType.AUTO)
    private Integer id;

    /**
     * 所属项目ID
     */
    private Integer projectId;

    /**
     * 房间名称 (例如: "Living Room", "Network Closet")
     */
    private String name;

    /**
     * 是否为机房/汇聚端 (head end)
     * 新建房间时根据名称关键字自动判断
     */
    private Boolean isHeadend;

    private LocalDateTime createdAt;
}
