package com.lvfield.equiptrack.service;

import com.lvfield.equiptrack.dto.milestone.CacheEntry;
import com.lvfield.equiptrack.dto.milestone.CacheStats;
import com.lvfield.equiptrack.dto.milestone.MilestonePercentageBundle;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * 里程碑两级缓存 (按项目ID分区)
 * <p>
 * 第一级：新鲜期内的结果直接返回；
 * 第二级：过期但还在的结果也立即返回，同时后台重算。
 * 任何可能改变数字的写操作都必须在返回前调用 {@link #invalidate(Integer)}。
 */
public interface MilestoneCacheService {

    Optional<CacheEntry> get(Integer projectId);

    void set(Integer projectId, MilestonePercentageBundle bundle);

    void invalidate(Integer projectId);

    /**
     * 看板读取入口：有缓存 (哪怕过期) 立即返回；没有则计算后返回
     */
    CompletableFuture<MilestonePercentageBundle> read(Integer projectId);

    /**
     * 多项目并发读取，结果按传入顺序排列
     */
    CompletableFuture<Map<Integer, MilestonePercentageBundle>> readAll(Collection<Integer> projectIds);

    void invalidateAll(Collection<Integer> projectIds);

    /**
     * 缺失或已过期、需要刷新的项目
     */
    List<Integer> needsRefresh(Collection<Integer> projectIds);

    CacheStats stats();
}
