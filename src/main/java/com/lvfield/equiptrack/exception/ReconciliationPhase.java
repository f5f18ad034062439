package com.lvfield.equiptrack.exception;

/**
 * 重导入的四个阶段，严格按声明顺序执行
 */
public enum ReconciliationPhase {

    SNAPSHOT("抓取关联快照", false),
    DELETE("删除旧设备", true),
    REIMPORT("写入新设备", true),
    RESTORE("恢复关联", false);

    private final String label;
    private final boolean destructive;

    ReconciliationPhase(String label, boolean destructive) {
        this.label = label;
        this.destructive = destructive;
    }

    public String getLabel() {
        return label;
    }

    /**
     * 该阶段失败时项目设备可能已经不完整
     */
    public boolean isDestructive() {
        return destructive;
    }
}
