package com.bmsedge.sticklist.exception;

/**
 * Request that cannot be processed as sent, e.g. an empty or non-Excel upload.
 */
public class BusinessException extends RuntimeException {

    public BusinessException(String message) {
        super(message);
    }
}
