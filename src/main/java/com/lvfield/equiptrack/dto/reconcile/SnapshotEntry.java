package com.lvfield.equiptrack.dto.reconcile;

import lombok.Builder;
import lombok.Value;

/**
 * 删除前抓取的一条关联，matchKey 用旧设备行算出
 */
@Value
@Builder
public class SnapshotEntry {

    Integer wireDropId;

    String wireDropName;

    String linkSide;

    Integer sortOrder;

    String matchKey;

    // 旧设备的描述信息，只用于失败报告

    Integer oldEquipmentId;

    String equipmentName;

    String partNumber;

    String roomName;

    public String describeEquipment() {
        return String.join(" / ",
                equipmentName == null ? "(未命名)" : equipmentName,
                partNumber == null ? "(无料号)" : partNumber,
                roomName == null ? "(无房间)" : roomName);
    }
}
