package com.lvfield.equiptrack.listener;

import com.lvfield.equiptrack.event.ShipmentDeliveredEvent;
import com.lvfield.equiptrack.service.QuantitySyncService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * 物流签收事件 → 设备到货
 */
@Slf4j
@Component
public class ShipmentDeliveryListener {

    @Autowired
    private QuantitySyncService quantitySyncService;

    @EventListener
    public void onDelivered(ShipmentDeliveredEvent event) {
        log.info("[物流签收] 运单 {} 签收，设备 [{}] 到货 {}", event.getTrackingNumber(),
                event.getEquipmentId(), event.getQuantity());
        quantitySyncService.applyReceipt(event.getEquipmentId(), event.getQuantity());
    }
}
