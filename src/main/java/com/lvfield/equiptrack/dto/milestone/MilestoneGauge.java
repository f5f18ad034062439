package com.lvfield.equiptrack.dto.milestone;

import lombok.Value;

/**
 * 单个进度仪表：百分比 + 分子分母
 */
@Value
public class MilestoneGauge {

    public static final MilestoneGauge EMPTY = new MilestoneGauge(0, 0, 0);

    int percentage;

    int completed;

    int total;
}
