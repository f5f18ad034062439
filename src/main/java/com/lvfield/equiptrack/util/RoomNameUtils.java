package com.lvfield.equiptrack.util;

import java.util.List;
import java.util.Locale;

/**
 * 房间名称工具类
 */
public final class RoomNameUtils {

    /**
     * 名称里带这些关键字的房间视为机房/汇聚端
     */
    private static final List<String> HEADEND_KEYWORDS =
            List.of("network", "head", "equipment", "rack", "structured", "mda", "server");

    private RoomNameUtils() {
    }

    /**
     * 去掉首尾空格、合并中间空白；空串返回 null
     */
    public static String clean(String name) {
        if (name == null) {
            return null;
        }
        String trimmed = name.trim().replaceAll("\\s+", " ");
        return trimmed.isEmpty() ? null : trimmed;
    }

    /**
     * 房间匹配用的键："Living  Room " 和 "living room" 视为同一个房间
     */
    public static String normalizeKey(String name) {
        String cleaned = clean(name);
        return cleaned == null ? null : cleaned.toLowerCase(Locale.ROOT);
    }

    public static boolean isHeadend(String name) {
        String key = normalizeKey(name);
        if (key == null) {
            return false;
        }
        return HEADEND_KEYWORDS.stream().anyMatch(key::contains);
    }
}
