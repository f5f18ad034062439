package com.lvfield.equiptrack.controller;

import com.lvfield.equiptrack.dto.ApiResponse;
import com.lvfield.equiptrack.dto.reconcile.ReconciliationReport;
import com.lvfield.equiptrack.dto.reconcile.ReimportRequest;
import com.lvfield.equiptrack.model.EquipmentImportBatch;
import com.lvfield.equiptrack.model.ProjectEquipment;
import com.lvfield.equiptrack.model.ProjectRoom;
import com.lvfield.equiptrack.service.EquipmentReconciliationService;
import com.lvfield.equiptrack.service.RoomService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 项目设备清单导入
 */
@RestController
@RequestMapping("/api/projects/{projectId}")
public class EquipmentImportController {

    @Autowired
    private EquipmentReconciliationService reconciliationService;

    @Autowired
    private RoomService roomService;

    /**
     * 用方案书解析结果整体替换项目的导入设备，并尽量恢复点位关联
     * 完整访问路径: POST /api/projects/{projectId}/equipment/reimport
     *
     * @return 导入报告；linksFailed 列出无法自动恢复的关联，前端必须完整展示
     */
    @PostMapping("/equipment/reimport")
    public ResponseEntity<ApiResponse<ReconciliationReport>> reimport(
            @PathVariable Integer projectId,
            @RequestBody ReimportRequest request,
            @RequestHeader(value = "X-User-Id", required = false) Integer userId) {

        if (request == null || request.getRows() == null || request.getRows().isEmpty()) {
            return ResponseEntity.badRequest().body(ApiResponse.error(400, "导入行不能为空"));
        }
        ReconciliationReport report = reconciliationService.reimport(
                projectId, request.getFilename(), request.getRows(), userId);
        return ResponseEntity.ok(ApiResponse.success(report.summary(), report));
    }

    @GetMapping("/equipment")
    public ApiResponse<List<ProjectEquipment>> listEquipment(@PathVariable Integer projectId) {
        return ApiResponse.success("获取成功", reconciliationService.listEquipment(projectId));
    }

    @GetMapping("/rooms")
    public ApiResponse<List<ProjectRoom>> listRooms(@PathVariable Integer projectId) {
        return ApiResponse.success("获取成功", roomService.listRooms(projectId));
    }

    /**
     * 历次导入批次，report_json 里保存了当时的导入报告
     */
    @GetMapping("/equipment/import-batches")
    public ApiResponse<List<EquipmentImportBatch>> listBatches(@PathVariable Integer projectId) {
        return ApiResponse.success("获取成功", reconciliationService.listBatches(projectId));
    }
}
