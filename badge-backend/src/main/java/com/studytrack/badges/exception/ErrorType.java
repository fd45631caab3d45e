package com.studytrack.badges.exception;

/**
 * 引擎错误分类，以及请求层应映射的 HTTP 状态码
 */
public enum ErrorType {
    INVALID_ARGUMENT(400),
    UNKNOWN_REQUIREMENT_KIND(500),
    DATA_UNAVAILABLE(503),
    PERSISTENCE_FAILURE(500),
    // 引擎分类之外的意外异常
    INTERNAL_ERROR(500);

    private final int httpStatus;

    ErrorType(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int getHttpStatus() {
        return httpStatus;
    }
}
