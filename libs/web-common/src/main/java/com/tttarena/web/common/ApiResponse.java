package com.tttarena.web.common;

import java.io.Serializable;

/**
 * 统一 API 响应格式
 *
 * @param code    响应状态码（200 成功 / 400 参数或操作非法 / 404 不存在 / 409 状态冲突）
 * @param message 响应消息
 * @param data    响应数据
 * @param <T>     响应数据类型
 */
public record ApiResponse<T>(int code, String message, T data) implements Serializable {

    public static <T> ApiResponse<T> success() {
        return new ApiResponse<>(200, "success", null);
    }

    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(200, "success", data);
    }

    public static <T> ApiResponse<T> error(int code, String message) {
        return new ApiResponse<>(code, message, null);
    }

    /** 400 Bad Request */
    public static <T> ApiResponse<T> badRequest(String message) {
        return error(400, message);
    }

    /** 404 Not Found */
    public static <T> ApiResponse<T> notFound(String message) {
        return error(404, message);
    }

    /** 409 Conflict */
    public static <T> ApiResponse<T> conflict(String message) {
        return error(409, message);
    }
}
