package com.lvfield.equiptrack.event;

import lombok.Value;

/**
 * 物流跟踪确认签收
 * 由物流跟踪模块发布，数量同步模块当作一次到货处理
 */
@Value
public class ShipmentDeliveredEvent {

    Integer equipmentId;

    int quantity;

    String trackingNumber;
}
