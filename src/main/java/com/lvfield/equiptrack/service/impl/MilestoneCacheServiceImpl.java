package com.lvfield.equiptrack.service.impl;

import com.lvfield.equiptrack.config.MilestoneProperties;
import com.lvfield.equiptrack.dto.milestone.CacheEntry;
import com.lvfield.equiptrack.dto.milestone.CacheStats;
import com.lvfield.equiptrack.dto.milestone.MilestonePercentageBundle;
import com.lvfield.equiptrack.event.MilestonesRefreshedEvent;
import com.lvfield.equiptrack.service.MilestoneCacheService;
import com.lvfield.equiptrack.service.MilestoneCalculationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 里程碑两级缓存实现 (进程内)
 * <p>
 * 1. entries: 每个项目最近一次成功计算的结果；
 * 2. inFlight: 正在进行的计算，同一项目的并发读取共享同一次计算；
 * 3. generations: 每次失效 +1，失效前发起的计算结果不再写回缓存。
 * <p>
 * 失效与带版本校验的写回都在 entries.compute 内完成，同一项目上二者互斥。
 */
@Slf4j
@Service
public class MilestoneCacheServiceImpl implements MilestoneCacheService {

    private final MilestoneCalculationService calculationService;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;
    private final Duration freshnessWindow;

    private final Map<Integer, CacheEntry> entries = new ConcurrentHashMap<>();
    private final Map<Integer, CompletableFuture<MilestonePercentageBundle>> inFlight = new ConcurrentHashMap<>();
    private final Map<Integer, AtomicLong> generations = new ConcurrentHashMap<>();

    @Autowired
    public MilestoneCacheServiceImpl(MilestoneCalculationService calculationService,
                                     ApplicationEventPublisher eventPublisher,
                                     Clock clock,
                                     MilestoneProperties properties) {
        this(calculationService, eventPublisher, clock, properties.getCacheFreshnessWindow());
    }

    public MilestoneCacheServiceImpl(MilestoneCalculationService calculationService,
                                     ApplicationEventPublisher eventPublisher,
                                     Clock clock,
                                     Duration freshnessWindow) {
        this.calculationService = calculationService;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        this.freshnessWindow = freshnessWindow;
    }

    @Override
    public Optional<CacheEntry> get(Integer projectId) {
        return Optional.ofNullable(entries.get(projectId));
    }

    @Override
    public void set(Integer projectId, MilestonePercentageBundle bundle) {
        CacheEntry entry = new CacheEntry(projectId, bundle, clock.instant());
        entries.put(projectId, entry);
        eventPublisher.publishEvent(new MilestonesRefreshedEvent(projectId, bundle, entry.getComputedAt()));
    }

    @Override
    public void invalidate(Integer projectId) {
        if (projectId == null) {
            return;
        }
        entries.compute(projectId, (id, current) -> {
            generation(id).incrementAndGet();
            return null;
        });
        inFlight.remove(projectId);
        log.debug("[里程碑缓存] 项目 [{}] 已失效", projectId);
    }

    @Override
    public void invalidateAll(Collection<Integer> projectIds) {
        projectIds.forEach(this::invalidate);
    }

    @Override
    public CompletableFuture<MilestonePercentageBundle> read(Integer projectId) {
        CacheEntry entry = entries.get(projectId);
        if (entry != null) {
            if (!entry.isFresh(clock.instant(), freshnessWindow)) {
                log.debug("[里程碑缓存] 项目 [{}] 结果已过期，先返回旧值并后台刷新", projectId);
                refresh(projectId);
            }
            return CompletableFuture.completedFuture(entry.getBundle());
        }
        return refresh(projectId);
    }

    @Override
    public CompletableFuture<Map<Integer, MilestonePercentageBundle>> readAll(Collection<Integer> projectIds) {
        Map<Integer, CompletableFuture<MilestonePercentageBundle>> futures = new LinkedHashMap<>();
        for (Integer projectId : new LinkedHashSet<>(projectIds)) {
            futures.put(projectId, read(projectId));
        }
        return CompletableFuture.allOf(futures.values().toArray(new CompletableFuture[0]))
                .thenApply(v -> {
                    Map<Integer, MilestonePercentageBundle> result = new LinkedHashMap<>();
                    futures.forEach((projectId, future) -> result.put(projectId, future.join()));
                    return result;
                });
    }

    @Override
    public List<Integer> needsRefresh(Collection<Integer> projectIds) {
        Instant now = clock.instant();
        List<Integer> result = new ArrayList<>();
        for (Integer projectId : projectIds) {
            CacheEntry entry = entries.get(projectId);
            if (entry == null || !entry.isFresh(now, freshnessWindow)) {
                result.add(projectId);
            }
        }
        return result;
    }

    @Override
    public CacheStats stats() {
        Instant now = clock.instant();
        int fresh = 0;
        int stale = 0;
        for (CacheEntry entry : entries.values()) {
            if (entry.isFresh(now, freshnessWindow)) {
                fresh++;
            } else {
                stale++;
            }
        }
        return new CacheStats(fresh + stale, fresh, stale, freshnessWindow.toMillis());
    }

    /**
     * 发起 (或加入) 一次计算；成功且期间未失效才写回缓存，失败不缓存
     */
    private CompletableFuture<MilestonePercentageBundle> refresh(Integer projectId) {
        long startedGeneration = generation(projectId).get();
        CompletableFuture<MilestonePercentageBundle> promise = new CompletableFuture<>();
        CompletableFuture<MilestonePercentageBundle> running = inFlight.putIfAbsent(projectId, promise);
        if (running != null) {
            return running;
        }

        CompletableFuture<MilestonePercentageBundle> computation;
        try {
            computation = calculationService.computeAsync(projectId);
        } catch (RuntimeException e) {
            computation = CompletableFuture.failedFuture(e);
        }

        computation.whenComplete((bundle, ex) -> {
            inFlight.remove(projectId, promise);
            if (ex != null) {
                Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
                log.warn("[里程碑缓存] 项目 [{}] 计算失败，不写入缓存: {}", projectId, cause.getMessage());
                promise.completeExceptionally(cause);
                return;
            }
            if (!setIfCurrent(projectId, bundle, startedGeneration)) {
                log.debug("[里程碑缓存] 项目 [{}] 计算期间已失效，丢弃本次结果", projectId);
            }
            promise.complete(bundle);
        });
        return promise;
    }

    /**
     * 仅当项目版本仍为 expectedGeneration 时写入；版本比较与写入在同一次 compute 中
     */
    private boolean setIfCurrent(Integer projectId, MilestonePercentageBundle bundle, long expectedGeneration) {
        CacheEntry candidate = new CacheEntry(projectId, bundle, clock.instant());
        CacheEntry stored = entries.compute(projectId, (id, current) ->
                generation(id).get() == expectedGeneration ? candidate : current);
        if (stored != candidate) {
            return false;
        }
        eventPublisher.publishEvent(new MilestonesRefreshedEvent(projectId, bundle, candidate.getComputedAt()));
        return true;
    }

    private AtomicLong generation(Integer projectId) {
        return generations.computeIfAbsent(projectId, id -> new AtomicLong());
    }
}
