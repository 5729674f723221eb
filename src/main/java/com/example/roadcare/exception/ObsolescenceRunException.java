package com.example.roadcare.exception;

/**
 * 过时标记运行中止
 */
public class ObsolescenceRunException extends RuntimeException {

    public ObsolescenceRunException(String message) {
        super(message);
    }

    public ObsolescenceRunException(String message, Throwable cause) {
        super(message, cause);
    }
}
