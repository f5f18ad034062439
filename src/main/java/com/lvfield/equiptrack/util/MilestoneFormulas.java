package com.lvfield.equiptrack.util;

import com.lvfield.equiptrack.dto.milestone.MilestoneGauge;
import com.lvfield.equiptrack.dto.milestone.PhaseRollup;
import com.lvfield.equiptrack.model.ProjectEquipment;
import com.lvfield.equiptrack.model.SiteProject;

import java.util.Collection;

/**
 * 里程碑百分比公式 (纯函数，无副作用)
 * <p>
 * 分母为 0 时一律返回 0%：空阶段代表"还没开始"，不是"已完成"。
 */
public final class MilestoneFormulas {

    private MilestoneFormulas() {
    }

    /**
     * 下单率 = 已下单 (ordered > 0) 的设备数 / 合格设备数
     * 调用方负责先按阶段筛出合格设备
     */
    public static MilestoneGauge ordersPercentage(Collection<ProjectEquipment> eligible) {
        int ordered = 0;
        for (ProjectEquipment item : eligible) {
            if (item.orderedOrZero() > 0) {
                ordered++;
            }
        }
        return gauge(ordered, eligible.size());
    }

    /**
     * 到货率 = 已全部到货 (received >= ordered 且 ordered > 0) 的设备数 / 合格设备数
     * 没下单的设备永远不算到货
     */
    public static MilestoneGauge receivingPercentage(Collection<ProjectEquipment> eligible) {
        int received = 0;
        for (ProjectEquipment item : eligible) {
            if (isFullyReceived(item)) {
                received++;
            }
        }
        return gauge(received, eligible.size());
    }

    /**
     * 施工率 = 该阶段已完成的点位数 / 点位总数
     */
    public static MilestoneGauge stagesPercentage(int completedDrops, int totalDrops) {
        return gauge(Math.min(completedDrops, totalDrops), totalDrops);
    }

    /**
     * 规划设计：接线图和方案书都有 = 100，只有一个 = 50
     */
    public static MilestoneGauge planningPercentage(SiteProject project) {
        if (project == null) {
            return MilestoneGauge.EMPTY;
        }
        int present = 0;
        if (hasText(project.getWiringDiagramUrl())) {
            present++;
        }
        if (hasText(project.getProposalUrl())) {
            present++;
        }
        return gauge(present, 2);
    }

    /**
     * 阶段汇总，按整数权重计算后四舍五入，避免浮点误差
     */
    public static PhaseRollup rollup(MilestoneGauge orders, MilestoneGauge receiving, MilestoneGauge stages) {
        int weighted = orders.getPercentage() * PhaseRollup.ORDERS_WEIGHT
                + receiving.getPercentage() * PhaseRollup.RECEIVING_WEIGHT
                + stages.getPercentage() * PhaseRollup.STAGES_WEIGHT;
        return new PhaseRollup(roundHalfUp(weighted, 100), orders, receiving, stages);
    }

    public static boolean isFullyReceived(ProjectEquipment item) {
        int ordered = item.orderedOrZero();
        return ordered > 0 && item.receivedOrZero() >= ordered;
    }

    static MilestoneGauge gauge(int completed, int total) {
        if (total <= 0) {
            return MilestoneGauge.EMPTY;
        }
        int bounded = Math.max(0, Math.min(completed, total));
        return new MilestoneGauge(roundHalfUp(bounded * 100, total), bounded, total);
    }

    private static int roundHalfUp(int numerator, int denominator) {
        return (2 * numerator + denominator) / (2 * denominator);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
