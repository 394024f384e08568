package com.spreadengine.exception;

import java.util.Map;

/**
 * A request that passed bean validation but cannot be evaluated, such as a decision input
 * with neither a price nor a price history, or a screening batch over the size limit.
 */
public class InvalidRequestException extends BaseException {

    public InvalidRequestException(String message) {
        super(ErrorCode.UNPROCESSABLE_INPUT, message);
    }

    public InvalidRequestException(String message, Map<String, Object> details) {
        super(ErrorCode.UNPROCESSABLE_INPUT, message, details);
    }

    public InvalidRequestException(String message, Throwable cause) {
        super(ErrorCode.UNPROCESSABLE_INPUT, message, null, cause);
    }
}
