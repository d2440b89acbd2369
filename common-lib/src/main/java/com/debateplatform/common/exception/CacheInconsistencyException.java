package com.debateplatform.common.exception;

/**
 * The result cache could not store a completed result. The caller still receives the
 * completed result; the persisted debate state stays the source of truth.
 */
public class CacheInconsistencyException extends RuntimeException {

    public CacheInconsistencyException(String message) {
        super(message);
    }

    public CacheInconsistencyException(String message, Throwable cause) {
        super(message, cause);
    }
}
