package com.lvfield.equiptrack.event;

import com.lvfield.equiptrack.dto.milestone.MilestonePercentageBundle;
import lombok.Value;

import java.time.Instant;

/**
 * 某项目的里程碑缓存刚被重新计算并写入
 * 看板等观察者监听这个事件刷新显示
 */
@Value
public class MilestonesRefreshedEvent {

    Integer projectId;

    MilestonePercentageBundle bundle;

    Instant computedAt;
}
