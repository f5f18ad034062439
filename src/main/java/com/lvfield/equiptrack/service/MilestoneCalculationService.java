package com.lvfield.equiptrack.service;

import com.lvfield.equiptrack.dto.milestone.MilestonePercentageBundle;

import java.util.concurrent.CompletableFuture;

/**
 * 里程碑百分比计算
 * 只读，无副作用，可并发、可重复调用
 */
public interface MilestoneCalculationService {

    /**
     * 同步计算，读库失败抛 MilestoneCalculationException
     */
    MilestonePercentageBundle compute(Integer projectId);

    /**
     * 异步计算，读库失败时以 MilestoneCalculationException 异常完成
     */
    CompletableFuture<MilestonePercentageBundle> computeAsync(Integer projectId);
}
