package com.studytrack.badges.exception;

/**
 * 调用方传入的参数非法（如排行榜 limit 越界），在任何 I/O 之前抛出
 */
public class InvalidArgumentException extends BadgeEngineException {

    public InvalidArgumentException(String message) {
        super(ErrorType.INVALID_ARGUMENT, message);
    }
}
