package com.tradestore.exception;

import java.util.Map;

/**
 * A request that is well-formed but not allowed in the record's current state,
 * e.g. closing a position that is already closed. Also used with {@link ErrorCode#VALIDATION_ERROR}
 * for argument combinations bean validation cannot express.
 */
public class BusinessException extends BaseException {

    public BusinessException(String message) {
        super(ErrorCode.INVALID_STATE, message);
    }

    public BusinessException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public BusinessException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }

    public BusinessException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(errorCode, message, details);
    }

    public BusinessException(String message, Map<String, Object> details) {
        super(ErrorCode.INVALID_STATE, message, details);
    }
}
