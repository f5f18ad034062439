package com.lvfield.equiptrack.controller;

import com.lvfield.equiptrack.dto.ApiResponse;
import com.lvfield.equiptrack.model.WireDropEquipmentLink;
import com.lvfield.equiptrack.model.WireDropStage;
import com.lvfield.equiptrack.service.WireDropService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/wire-drops")
public class WireDropController {

    @Autowired
    private WireDropService wireDropService;

    @PostMapping("/{wireDropId}/equipment")
    public ApiResponse<WireDropEquipmentLink> linkEquipment(
            @PathVariable Integer wireDropId,
            @RequestParam Integer equipmentId,
            @RequestParam String side,
            @RequestParam(required = false) Integer sortOrder) {
        WireDropEquipmentLink link = wireDropService.linkEquipment(wireDropId, equipmentId, side, sortOrder);
        return ApiResponse.success("关联成功", link);
    }

    /**
     * 标记阶段完成
     * 完整访问路径: POST /api/wire-drops/{wireDropId}/stages/{stageType}/complete
     */
    @PostMapping("/{wireDropId}/stages/{stageType}/complete")
    public ApiResponse<WireDropStage> completeStage(
            @PathVariable Integer wireDropId,
            @PathVariable String stageType,
            @RequestParam(required = false) String photoUrl) {
        return ApiResponse.success("阶段已完成",
                wireDropService.markStageComplete(wireDropId, stageType, photoUrl));
    }
}
