package com.lvfield.equiptrack.exception;

import com.lvfield.equiptrack.dto.ApiResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * 全局异常处理，统一转成 ApiResponse
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(ReconciliationPhaseException.class)
    public ResponseEntity<ApiResponse<Map<String, Object>>> handleReconciliation(ReconciliationPhaseException e) {
        log.warn("[设备重导入] 项目 [{}] 阶段 {} 失败: {}", e.getProjectId(), e.getPhase(), e.getMessage());
        HttpStatus status = e.requiresRetry() ? HttpStatus.INTERNAL_SERVER_ERROR : HttpStatus.SERVICE_UNAVAILABLE;
        Map<String, Object> detail = Map.of(
                "phase", e.getPhase().name(),
                "requiresRetry", e.requiresRetry(),
                "batchId", e.getBatchId() == null ? "" : e.getBatchId());
        return ResponseEntity.status(status).body(ApiResponse.error(status.value(), e.getMessage(), detail));
    }

    @ExceptionHandler(MilestoneCalculationException.class)
    public ResponseEntity<ApiResponse<Object>> handleCalculation(MilestoneCalculationException e) {
        log.error("[里程碑] 项目 [{}] 计算失败", e.getProjectId(), e);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(ApiResponse.error(HttpStatus.SERVICE_UNAVAILABLE.value(), e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse<Object>> handleBadRequest(IllegalArgumentException e) {
        log.warn("请求参数错误: {}", e.getMessage());
        return ResponseEntity.badRequest().body(ApiResponse.error(HttpStatus.BAD_REQUEST.value(), e.getMessage()));
    }
}
