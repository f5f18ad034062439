package com.lvfield.equiptrack.dto.milestone;

import com.lvfield.equiptrack.model.StageType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * 某项目点位阶段完成情况：点位总数 + 每个阶段已完成的点位数
 */
public final class StageCompletion {

    private final int totalDrops;
    private final Map<StageType, Integer> completedDrops;

    public StageCompletion(int totalDrops, Map<StageType, Integer> completedDrops) {
        this.totalDrops = totalDrops;
        EnumMap<StageType, Integer> copy = new EnumMap<>(StageType.class);
        copy.putAll(completedDrops);
        this.completedDrops = Collections.unmodifiableMap(copy);
    }

    public static StageCompletion empty() {
        return new StageCompletion(0, Collections.emptyMap());
    }

    public int getTotalDrops() {
        return totalDrops;
    }

    public int completed(StageType stage) {
        return completedDrops.getOrDefault(stage, 0);
    }
}
