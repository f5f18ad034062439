package com.lvfield.equiptrack.model;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 施工项目实体类
 * 对应数据库表: site_project
 * 这里只保留进度计算关心的字段（接线图、方案书链接）
 */
@Data
@TableName("site_project")
public class SiteProject {

    @TableId(type = IdType.AUTO)
    private Integer id;

    private String projectName;

    /**
     * 接线图地址 (Lucid 导出)
     */
    private String wiringDiagramUrl;

    /**
     * 客户方案书地址
     */
    private String proposalUrl;

    private LocalDateTime createdAt;
}
