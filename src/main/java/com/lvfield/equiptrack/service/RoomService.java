package com.lvfield.equiptrack.service;

import com.lvfield.equiptrack.dto.reconcile.ResolvedIndex;
import com.lvfield.equiptrack.model.ProjectRoom;

import java.util.Collection;
import java.util.List;

public interface RoomService {

    /**
     * 按归一化名称查找项目房间，没有的新建 (每个名称只建一次)
     */
    ResolvedIndex<ProjectRoom> ensureRooms(Integer projectId, Collection<String> roomNames);

    List<ProjectRoom> listRooms(Integer projectId);
}
