package com.lvfield.equiptrack.service;

import com.lvfield.equiptrack.dto.reconcile.ParsedRow;
import com.lvfield.equiptrack.dto.reconcile.ResolvedIndex;
import com.lvfield.equiptrack.model.GlobalPart;

import java.util.Collection;

/**
 * 全局物料目录同步
 */
public interface GlobalPartService {

    /**
     * 为每个不同的料号 (不区分大小写) 找到或新建目录条目
     * 已有条目的 required_for_prewire 不会被修改
     */
    ResolvedIndex<GlobalPart> syncParts(Collection<ParsedRow> rows);
}
