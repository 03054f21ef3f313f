package com.repledger.exception;

import java.util.Map;

/**
 * Expected, recoverable business outcome. Callers are meant to branch on these
 * (retry with a smaller amount, top up liquidity) rather than treat them as faults.
 */
public class BusinessException extends BaseException {

    public BusinessException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public BusinessException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(errorCode, message, details);
    }
}
