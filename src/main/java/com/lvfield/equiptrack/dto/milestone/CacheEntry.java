package com.lvfield.equiptrack.dto.milestone;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * 缓存条目，computedAt 永远是最近一次计算成功的时间
 */
@Value
public class CacheEntry {

    Integer projectId;

    MilestonePercentageBundle bundle;

    Instant computedAt;

    public boolean isFresh(Instant now, Duration freshnessWindow) {
        return !now.isAfter(computedAt.plus(freshnessWindow));
    }
}
