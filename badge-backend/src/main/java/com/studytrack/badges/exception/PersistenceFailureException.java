package com.studytrack.badges.exception;

/**
 * 写入失败。单条写入失败由颁发引擎收集；整批全部失败时才向上抛出。
 */
public class PersistenceFailureException extends BadgeEngineException {

    public PersistenceFailureException(String message) {
        super(ErrorType.PERSISTENCE_FAILURE, message);
    }

    public PersistenceFailureException(String message, Throwable cause) {
        super(ErrorType.PERSISTENCE_FAILURE, message, cause);
    }
}
