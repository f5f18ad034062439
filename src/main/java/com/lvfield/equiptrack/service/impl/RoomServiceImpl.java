package com.lvfield.equiptrack.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.QueryWrapper;
import com.lvfield.equiptrack.dto.reconcile.ResolvedIndex;
import com.lvfield.equiptrack.mapper.ProjectRoomMapper;
import com.lvfield.equiptrack.model.ProjectRoom;
import com.lvfield.equiptrack.service.RoomService;
import com.lvfield.equiptrack.util.RoomNameUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
public class RoomServiceImpl implements RoomService {

    @Autowired
    private ProjectRoomMapper roomMapper;

    @Override
    public ResolvedIndex<ProjectRoom> ensureRooms(Integer projectId, Collection<String> roomNames) {
        // 1. 现有房间建索引
        Map<String, ProjectRoom> index = new HashMap<>();
        for (ProjectRoom room : listRooms(projectId)) {
            String key = RoomNameUtils.normalizeKey(room.getName());
            if (key != null) {
                index.putIfAbsent(key, room);
            }
        }

        // 2. 缺的房间新建
        int created = 0;
        for (String rawName : roomNames) {
            String key = RoomNameUtils.normalizeKey(rawName);
            if (key == null || index.containsKey(key)) {
                continue;
            }
            ProjectRoom room = new ProjectRoom();
            room.setProjectId(projectId);
            room.setName(RoomNameUtils.clean(rawName));
            room.setIsHeadend(RoomNameUtils.isHeadend(rawName));
            room.setCreatedAt(LocalDateTime.now());
            roomMapper.insert(room);
            index.put(key, room);
            created++;
            log.info("[房间] 项目 [{}] 新建房间: {} (机房: {})", projectId, room.getName(), room.getIsHeadend());
        }
        return new ResolvedIndex<>(index, created, RoomNameUtils::normalizeKey);
    }

    @Override
    public List<ProjectRoom> listRooms(Integer projectId) {
        QueryWrapper<ProjectRoom> query = new QueryWrapper<>();
        query.eq("project_id", projectId).orderByAsc("id");
        return roomMapper.selectList(query);
    }
}
