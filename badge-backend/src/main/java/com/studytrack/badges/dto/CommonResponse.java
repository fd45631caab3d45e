package com.studytrack.badges.dto;

import com.studytrack.badges.exception.ErrorType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

/**
 * 通用响应结构：引擎对外的每个操作都返回它而不是抛出异常，
 * 由请求层根据 code 映射为 HTTP 状态。
 *
 * @param <T> 业务数据类型
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CommonResponse<T> implements Serializable {

    private Boolean success;

    // 状态码：200, 400, 500, 503
    private Integer code;

    // 响应描述信息
    private String message;

    // 失败时的错误分类，成功时为 null
    private ErrorType error;

    // 业务数据 (可以是任何DTO, List, 或 null)
    private T data;

    // 响应时间戳 (ms)
    private Long timestamp;

    /**
     * 构造成功响应 (状态码 200)
     */
    public static <T> CommonResponse<T> success(T data, String message) {
        return new CommonResponse<>(
                true,
                200,
                message,
                null,
                data,
                Instant.now().toEpochMilli()
        );
    }

    /**
     * 构造失败响应，状态码取自错误分类
     */
    public static <T> CommonResponse<T> error(ErrorType error, String message) {
        return new CommonResponse<>(
                false,
                error.getHttpStatus(),
                message,
                error,
                null,
                Instant.now().toEpochMilli()
        );
    }
}
