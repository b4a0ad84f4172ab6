package com.tradestore.exception;

import java.util.Map;

/** Thrown when a caller-assigned key is already taken (e.g. a duplicate account id). */
public class ConflictException extends BaseException {

    public ConflictException(String message, Map<String, Object> details) {
        super(ErrorCode.CONFLICT, message, details);
    }
}
