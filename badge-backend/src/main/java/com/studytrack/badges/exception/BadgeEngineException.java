package com.studytrack.badges.exception;

/**
 * 徽章引擎所有业务异常的基类
 */
public abstract class BadgeEngineException extends RuntimeException {

    private final ErrorType errorType;

    protected BadgeEngineException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    protected BadgeEngineException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    public ErrorType getErrorType() {
        return errorType;
    }
}
