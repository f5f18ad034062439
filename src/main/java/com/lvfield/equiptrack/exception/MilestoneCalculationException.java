package com.lvfield.equiptrack.exception;

/**
 * 里程碑计算时读库失败；缓存不会保存失败结果，下次读取会重新计算
 */
public class MilestoneCalculationException extends RuntimeException {

    private final Integer projectId;

    public MilestoneCalculationException(Integer projectId, String message, Throwable cause) {
        super(message, cause);
        this.projectId = projectId;
    }

    public Integer getProjectId() {
        return projectId;
    }
}
