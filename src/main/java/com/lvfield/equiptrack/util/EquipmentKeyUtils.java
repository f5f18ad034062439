package com.lvfield.equiptrack.util;

import com.lvfield.equiptrack.model.InstallSide;
import com.lvfield.equiptrack.model.ProjectEquipment;

import java.util.Locale;

/**
 * 设备匹配键工具类
 * <p>
 * 方案书每次重导入都会给出一份完整的新清单，没有任何稳定ID，
 * 只能用设备的描述性字段拼出一个匹配键，把旧的点位关联对到新设备上。
 * 键的组成 (顺序固定)：料号 | 房间ID | 安装端 | 名称，料号和名称统一转小写。
 * 缺失的字段贡献空串，不会报错。
 */
public final class EquipmentKeyUtils {

    /**
     * 分隔符用不可见的单元分隔符，正常的料号/名称里不会出现
     */
    public static final String SEPARATOR = "\u001F";

    private EquipmentKeyUtils() {
    }

    public static String buildKey(ProjectEquipment item) {
        if (item == null) {
            return buildKey(null, null, null, null);
        }
        return buildKey(item.getPartNumber(), item.getRoomId(), item.getInstallSide(), item.getName());
    }

    public static String buildKey(String partNumber, Integer roomId, String installSide, String name) {
        return normalize(partNumber)
                + SEPARATOR + (roomId == null ? "" : roomId.toString())
                + SEPARATOR + InstallSide.fromCode(installSide).getCode()
                + SEPARATOR + normalize(name);
    }

    private static String normalize(String value) {
        if (value == null) {
            return "";
        }
        return value.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }
}
