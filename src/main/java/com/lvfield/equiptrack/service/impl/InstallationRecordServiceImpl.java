package com.lvfield.equiptrack.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.QueryWrapper;
import com.lvfield.equiptrack.dto.milestone.StageCompletion;
import com.lvfield.equiptrack.mapper.WireDropEquipmentLinkMapper;
import com.lvfield.equiptrack.mapper.WireDropMapper;
import com.lvfield.equiptrack.mapper.WireDropStageMapper;
import com.lvfield.equiptrack.model.StageType;
import com.lvfield.equiptrack.model.WireDrop;
import com.lvfield.equiptrack.model.WireDropEquipmentLink;
import com.lvfield.equiptrack.model.WireDropStage;
import com.lvfield.equiptrack.service.InstallationRecordService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

@Slf4j
@Service
public class InstallationRecordServiceImpl implements InstallationRecordService {

    private final WireDropMapper wireDropMapper;
    private final WireDropStageMapper wireDropStageMapper;
    private final WireDropEquipmentLinkMapper linkMapper;

    public InstallationRecordServiceImpl(WireDropMapper wireDropMapper,
                                         WireDropStageMapper wireDropStageMapper,
                                         WireDropEquipmentLinkMapper linkMapper) {
        this.wireDropMapper = wireDropMapper;
        this.wireDropStageMapper = wireDropStageMapper;
        this.linkMapper = linkMapper;
    }

    @Override
    public List<WireDropEquipmentLink> listLinks(Integer projectId) {
        return linkMapper.selectByProjectId(projectId);
    }

    @Override
    public StageCompletion getStageCompletion(Integer projectId) {
        // 1. 点位总数
        Long total = wireDropMapper.selectCount(new QueryWrapper<WireDrop>().eq("project_id", projectId));
        int totalDrops = total == null ? 0 : total.intValue();
        if (totalDrops == 0) {
            return StageCompletion.empty();
        }

        // 2. 每个阶段按点位去重统计完成数
        Map<StageType, Set<Integer>> doneDrops = new EnumMap<>(StageType.class);
        for (WireDropStage stage : wireDropStageMapper.selectByProjectId(projectId)) {
            if (!stage.isDone()) {
                continue;
            }
            StageType type;
            try {
                type = StageType.fromCode(stage.getStageType());
            } catch (IllegalArgumentException e) {
                // 历史数据里的未知阶段不参与统计
                log.debug("[点位] 忽略未知阶段: {}", stage.getStageType());
                continue;
            }
            doneDrops.computeIfAbsent(type, t -> new HashSet<>()).add(stage.getWireDropId());
        }

        Map<StageType, Integer> counts = new EnumMap<>(StageType.class);
        doneDrops.forEach((type, ids) -> counts.put(type, ids.size()));
        return new StageCompletion(totalDrops, counts);
    }

    @Override
    public Map<Integer, WireDrop> getWireDrops(Collection<Integer> wireDropIds) {
        if (wireDropIds == null || wireDropIds.isEmpty()) {
            return Collections.emptyMap();
        }
        return wireDropMapper.selectBatchIds(wireDropIds).stream()
                .collect(Collectors.toMap(WireDrop::getId, Function.identity()));
    }
}
