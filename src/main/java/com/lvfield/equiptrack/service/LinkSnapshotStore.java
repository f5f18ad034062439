package com.lvfield.equiptrack.service;

import com.lvfield.equiptrack.dto.reconcile.ReconciliationSnapshot;

/**
 * 重导入前抓取点位-设备关联快照
 */
public interface LinkSnapshotStore {

    /**
     * 只读操作：抓取项目内所有指向"带批次号设备"的关联
     * 手工录入设备上的关联不会被删除，所以不进快照
     */
    ReconciliationSnapshot capture(Integer projectId);
}
