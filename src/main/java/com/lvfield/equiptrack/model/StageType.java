package com.lvfield.equiptrack.model;

/**
 * 线缆点位 (wire drop) 的施工阶段
 */
public enum StageType {

    PREWIRE("prewire"),
    TRIM_OUT("trim_out"),
    COMMISSION("commission");

    private final String code;

    StageType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static StageType fromCode(String code) {
        for (StageType type : values()) {
            if (type.code.equalsIgnoreCase(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("未知的施工阶段: " + code);
    }
}
