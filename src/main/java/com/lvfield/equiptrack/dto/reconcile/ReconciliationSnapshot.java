package com.lvfield.equiptrack.dto.reconcile;

import java.util.Collections;
import java.util.List;

/**
 * 重导入前的关联快照，只在内存中存在，不落库
 */
public final class ReconciliationSnapshot {

    private final Integer projectId;
    private final List<SnapshotEntry> entries;

    public ReconciliationSnapshot(Integer projectId, List<SnapshotEntry> entries) {
        this.projectId = projectId;
        this.entries = Collections.unmodifiableList(entries);
    }

    public Integer getProjectId() {
        return projectId;
    }

    public List<SnapshotEntry> getEntries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
