package com.ironcondor.exception;

/**
 * Wraps an unexpected failure inside an analytics computation. Degenerate inputs
 * (zero time, zero max loss) are handled by fallback branches and never end up here.
 */
public class ComputationException extends BaseException {

    public ComputationException(String operation, Throwable cause) {
        super(ErrorCode.COMPUTATION_FAILED, operation + " failed: " + cause.getMessage(), cause);
    }
}
