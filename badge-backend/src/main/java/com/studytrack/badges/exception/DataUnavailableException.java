package com.studytrack.badges.exception;

/**
 * 依赖的读取失败。不允许降级为空结果。
 */
public class DataUnavailableException extends BadgeEngineException {

    public DataUnavailableException(String message, Throwable cause) {
        super(ErrorType.DATA_UNAVAILABLE, message, cause);
    }
}
