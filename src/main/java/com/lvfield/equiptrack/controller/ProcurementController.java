package com.lvfield.equiptrack.controller;

import com.lvfield.equiptrack.dto.ApiResponse;
import com.lvfield.equiptrack.model.MilestonePhase;
import com.lvfield.equiptrack.model.ProjectEquipment;
import com.lvfield.equiptrack.service.QuantitySyncService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * 采购：下单、到货、人工更正
 */
@RestController
@RequestMapping("/api/procurement")
public class ProcurementController {

    @Autowired
    private QuantitySyncService quantitySyncService;

    @PostMapping("/equipment/{id}/receive")
    public ApiResponse<ProjectEquipment> receive(@PathVariable Integer id,
                                                 @RequestParam int quantity) {
        ProjectEquipment item = quantitySyncService.applyReceipt(id, quantity);
        String message = item.isOverReceived() ? "到货已记录，注意：到货数量超过下单数量" : "到货已记录";
        return ApiResponse.success(message, item);
    }

    @PostMapping("/equipment/{id}/order")
    public ApiResponse<ProjectEquipment> order(@PathVariable Integer id,
                                               @RequestParam int quantity) {
        return ApiResponse.success("下单已记录", quantitySyncService.applyOrder(id, quantity));
    }

    /**
     * 人工更正，不传的字段保持不变
     */
    @PostMapping("/equipment/{id}/correct")
    public ApiResponse<ProjectEquipment> correct(@PathVariable Integer id,
                                                 @RequestParam(required = false) Integer ordered,
                                                 @RequestParam(required = false) Integer received) {
        return ApiResponse.success("数量已更正",
                quantitySyncService.correctQuantities(id, ordered, received));
    }

    /**
     * 一键全部到货
     * 完整访问路径: POST /api/procurement/projects/{projectId}/receive-all?phase=prewire
     */
    @PostMapping("/projects/{projectId}/receive-all")
    public ApiResponse<Integer> receiveAll(@PathVariable Integer projectId,
                                           @RequestParam String phase) {
        int changed = quantitySyncService.applyFullReceipt(projectId, MilestonePhase.fromCode(phase));
        return ApiResponse.success("已更新 " + changed + " 件设备", changed);
    }
}
