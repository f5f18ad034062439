package com.lvfield.equiptrack.dto.milestone;

import lombok.Builder;
import lombok.Value;

/**
 * 一个项目的全部里程碑百分比
 * 只缓存，不落库；所有值都在 [0, 100]
 */
@Value
@Builder
public class MilestonePercentageBundle {

    Integer projectId;

    int planning;

    int prewireOrders;

    int prewireReceiving;

    int prewireStages;

    int trimOrders;

    int trimReceiving;

    int trimStages;

    int commissioning;

    PhaseRollup prewirePhase;

    PhaseRollup trimPhase;
}
