package com.lvfield.equiptrack.model;

/**
 * 采购/安装阶段，用来划定"下单率"、"到货率"统计哪些设备
 * <p>
 * 预布线 (prewire)：目录里标记了 required_for_prewire 的物料；
 * 收尾 (trim)：其余全部设备，包括没有关联目录的设备。
 * 计划数量为 0 的设备不参与任何阶段。
 */
public enum MilestonePhase {

    PREWIRE,
    TRIM;

    public boolean isEligible(ProjectEquipment item, GlobalPart part) {
        if (item == null || item.plannedOrZero() <= 0) {
            return false;
        }
        boolean prewirePart = part != null && Boolean.TRUE.equals(part.getRequiredForPrewire());
        return this == PREWIRE ? prewirePart : !prewirePart;
    }

    public static MilestonePhase fromCode(String code) {
        if (code != null) {
            for (MilestonePhase phase : values()) {
                if (phase.name().equalsIgnoreCase(code.trim())) {
                    return phase;
                }
            }
        }
        throw new IllegalArgumentException("未知的阶段: " + code + " (可选: prewire / trim)");
    }
}
