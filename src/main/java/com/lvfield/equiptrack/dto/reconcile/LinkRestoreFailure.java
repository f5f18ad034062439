package com.lvfield.equiptrack.dto.reconcile;

import lombok.Builder;
import lombok.Data;

/**
 * 一条没能恢复的点位-设备关联
 * 带上旧设备的名称、料号、房间，方便人工重新关联
 */
@Data
@Builder
public class LinkRestoreFailure {

    public static final String REASON_NOT_FOUND = "not found in new import";
    public static final String REASON_DUPLICATE = "duplicate link after reimport";

    private Integer wireDropId;

    private String wireDropName;

    private String linkSide;

    private Integer sortOrder;

    private String equipmentName;

    private String partNumber;

    private String roomName;

    /** 例如 "CAT6 Jack #2 / CAT6-JK / Living Room" */
    private String describedEquipment;

    private String reason;
}
