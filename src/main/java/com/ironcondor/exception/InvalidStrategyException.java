package com.ironcondor.exception;

import java.util.Map;

public class InvalidStrategyException extends BaseException {

    public InvalidStrategyException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }

    public InvalidStrategyException(String message, Map<String, Object> details) {
        super(ErrorCode.VALIDATION_ERROR, message, details);
    }
}
