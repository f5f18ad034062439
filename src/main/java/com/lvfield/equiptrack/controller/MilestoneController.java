package com.lvfield.equiptrack.controller;

import com.lvfield.equiptrack.dto.ApiResponse;
import com.lvfield.equiptrack.dto.milestone.CacheStats;
import com.lvfield.equiptrack.dto.milestone.MilestonePercentageBundle;
import com.lvfield.equiptrack.service.MilestoneCacheService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * 里程碑进度 (看板 / 项目详情)
 * 返回 CompletableFuture，计算期间不占用请求线程
 */
@RestController
@RequestMapping("/api/milestones")
public class MilestoneController {

    @Autowired
    private MilestoneCacheService milestoneCacheService;

    @GetMapping("/{projectId}")
    public CompletableFuture<ApiResponse<MilestonePercentageBundle>> getProject(
            @PathVariable Integer projectId) {
        return milestoneCacheService.read(projectId)
                .thenApply(bundle -> ApiResponse.success("获取成功", bundle));
    }

    /**
     * 看板：多个项目并发读取
     * 完整访问路径: GET /api/milestones?projectIds=1,2,3
     */
    @GetMapping
    public CompletableFuture<ApiResponse<Map<Integer, MilestonePercentageBundle>>> getProjects(
            @RequestParam List<Integer> projectIds) {
        return milestoneCacheService.readAll(projectIds)
                .thenApply(bundles -> ApiResponse.success("获取成功", bundles));
    }

    @GetMapping("/cache/stats")
    public ApiResponse<CacheStats> stats() {
        return ApiResponse.success("获取成功", milestoneCacheService.stats());
    }

    @DeleteMapping("/{projectId}/cache")
    public ApiResponse<Object> invalidate(@PathVariable Integer projectId) {
        milestoneCacheService.invalidate(projectId);
        return ApiResponse.success("缓存已失效");
    }
}
