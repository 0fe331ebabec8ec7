package com.gotable.common.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 모든 컨트롤러가 공유하는 응답 래퍼 ({@code success}, {@code data}, {@code message}).
 * null 필드는 JSON에서 생략된다.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(boolean success, T data, String message) {

    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(true, data, null);
    }

    public static <T> ApiResponse<T> ok(T data, String message) {
        return new ApiResponse<>(true, data, message);
    }
}
