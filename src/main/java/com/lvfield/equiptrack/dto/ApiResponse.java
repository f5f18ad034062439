package com.lvfield.equiptrack.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;

/**
 * 前后端交互的统一数据格式封装
 */
@Data
public class ApiResponse<T> {

    private int status;
    private String message;
    private T data;

    // --- 成功响应 ---

    public static <T> ApiResponse<T> success(String message, T data) {
        return of(200, message, data);
    }

    public static <T> ApiResponse<T> success(String message) {
        return of(200, message, null);
    }

    // --- 失败响应 ---

    /**
     * 默认失败 (500)
     */
    public static <T> ApiResponse<T> error(String message) {
        return of(500, message, null);
    }

    /**
     * 自定义错误码失败；data 可以携带部分结果 (比如导入失败时已生成的批次号)
     */
    public static <T> ApiResponse<T> error(int status, String message, T data) {
        return of(status, message, data);
    }

    public static <T> ApiResponse<T> error(int status, String message) {
        return of(status, message, null);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return status == 200;
    }

    private static <T> ApiResponse<T> of(int status, String message, T data) {
        ApiResponse<T> response = new ApiResponse<>();
        response.setStatus(status);
        response.setMessage(message);
        response.setData(data);
        return response;
    }
}
