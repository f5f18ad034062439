package com.lvfield.equiptrack.model;

import java.util.Locale;

/**
 * 设备安装端
 * 数据库中存小写编码
 */
public enum InstallSide {

    ROOM_END("room_end"),
    HEAD_END("head_end"),
    UNSPECIFIED("unspecified");

    private final String code;

    InstallSide(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * 解析编码，无法识别或为空时返回 UNSPECIFIED
     */
    public static InstallSide fromCode(String code) {
        if (code == null) {
            return UNSPECIFIED;
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (InstallSide side : values()) {
            if (side.code.equals(normalized)) {
                return side;
            }
        }
        return UNSPECIFIED;
    }
}
