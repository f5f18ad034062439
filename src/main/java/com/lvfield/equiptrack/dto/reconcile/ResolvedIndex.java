package com.lvfield.equiptrack.dto.reconcile;

import java.util.Collections;
import java.util.Map;
import java.util.function.Function;

/**
 * 按名称/料号解析 (找不到就新建) 之后的结果索引
 * 查找时用同一个归一化函数处理原始字符串
 */
public final class ResolvedIndex<T> {

    private final Map<String, T> byKey;
    private final int created;
    private final Function<String, String> keyFunction;

    public ResolvedIndex(Map<String, T> byKey, int created, Function<String, String> keyFunction) {
        this.byKey = Collections.unmodifiableMap(byKey);
        this.created = created;
        this.keyFunction = keyFunction;
    }

    /**
     * 原始名称为空或没有解析过时返回 null
     */
    public T find(String raw) {
        String key = keyFunction.apply(raw);
        return key == null ? null : byKey.get(key);
    }

    public int getCreated() {
        return created;
    }

    public int size() {
        return byKey.size();
    }
}
