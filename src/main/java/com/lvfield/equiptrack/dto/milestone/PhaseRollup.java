package com.lvfield.equiptrack.dto.milestone;

import lombok.Value;

/**
 * 阶段汇总 = 下单 25% + 到货 35% + 施工 40%
 * 三个分项原样带给前端，用于展开说明
 */
@Value
public class PhaseRollup {

    public static final int ORDERS_WEIGHT = 25;
    public static final int RECEIVING_WEIGHT = 35;
    public static final int STAGES_WEIGHT = 40;

    int percentage;

    MilestoneGauge orders;

    MilestoneGauge receiving;

    MilestoneGauge stages;
}
