package com.lvfield.equiptrack.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.QueryWrapper;
import com.lvfield.equiptrack.dto.reconcile.ParsedRow;
import com.lvfield.equiptrack.dto.reconcile.ResolvedIndex;
import com.lvfield.equiptrack.mapper.GlobalPartMapper;
import com.lvfield.equiptrack.model.GlobalPart;
import com.lvfield.equiptrack.service.GlobalPartService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

@Slf4j
@Service
public class GlobalPartServiceImpl implements GlobalPartService {

    @Autowired
    private GlobalPartMapper globalPartMapper;

    @Override
    public ResolvedIndex<GlobalPart> syncParts(Collection<ParsedRow> rows) {
        // 1. 按料号去重，保留第一次出现的行 (名称/厂家/型号取自这一行)
        Map<String, ParsedRow> firstRows = new LinkedHashMap<>();
        for (ParsedRow row : rows) {
            String key = partKey(row.getCatalogPartId());
            if (key != null) {
                firstRows.putIfAbsent(key, row);
            }
        }

        // 2. 逐个解析，目录里没有的新建
        Map<String, GlobalPart> index = new HashMap<>();
        int created = 0;
        for (Map.Entry<String, ParsedRow> entry : firstRows.entrySet()) {
            QueryWrapper<GlobalPart> query = new QueryWrapper<>();
            query.apply("LOWER(part_number) = {0}", entry.getKey()).orderByAsc("id").last("LIMIT 1");
            GlobalPart part = globalPartMapper.selectOne(query);
            if (part == null) {
                ParsedRow row = entry.getValue();
                part = new GlobalPart();
                part.setPartNumber(row.getCatalogPartId().trim());
                part.setName(row.getName() == null ? null : row.getName().trim());
                part.setManufacturer(row.getManufacturer());
                part.setModel(row.getModel());
                part.setRequiredForPrewire(false);
                part.setCreatedAt(LocalDateTime.now());
                globalPartMapper.insert(part);
                created++;
                log.info("[物料目录] 新建物料: {}", part.getPartNumber());
            }
            index.put(entry.getKey(), part);
        }
        return new ResolvedIndex<>(index, created, GlobalPartServiceImpl::partKey);
    }

    static String partKey(String partNumber) {
        if (partNumber == null || partNumber.isBlank()) {
            return null;
        }
        return partNumber.trim().toLowerCase(Locale.ROOT);
    }
}
