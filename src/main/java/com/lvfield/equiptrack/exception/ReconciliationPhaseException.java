package com.lvfield.equiptrack.exception;

/**
 * 重导入某个阶段的存储操作失败
 * <p>
 * SNAPSHOT 失败时还没有删除任何数据；DELETE / REIMPORT 失败时项目设备可能不完整，需要操作员重试；
 * RESTORE 失败时新设备已经写入，只是关联没有恢复。
 */
public class ReconciliationPhaseException extends RuntimeException {

    private final Integer projectId;
    private final ReconciliationPhase phase;
    private final Integer batchId;

    public ReconciliationPhaseException(Integer projectId, ReconciliationPhase phase, Integer batchId, Throwable cause) {
        super(buildMessage(projectId, phase, cause), cause);
        this.projectId = projectId;
        this.phase = phase;
        this.batchId = batchId;
    }

    public Integer getProjectId() {
        return projectId;
    }

    public ReconciliationPhase getPhase() {
        return phase;
    }

    public Integer getBatchId() {
        return batchId;
    }

    public boolean requiresRetry() {
        return phase.isDestructive();
    }

    private static String buildMessage(Integer projectId, ReconciliationPhase phase, Throwable cause) {
        String detail = cause == null ? "" : ": " + cause.getMessage();
        if (phase.isDestructive()) {
            return "项目 [" + projectId + "] 重导入失败 (" + phase.getLabel() + ")，项目设备可能不完整，请重新导入" + detail;
        }
        if (phase == ReconciliationPhase.RESTORE) {
            return "项目 [" + projectId + "] 设备已导入，但关联恢复失败，请人工检查点位关联" + detail;
        }
        return "项目 [" + projectId + "] 重导入中止 (" + phase.getLabel() + ")，未删除任何数据" + detail;
    }
}
