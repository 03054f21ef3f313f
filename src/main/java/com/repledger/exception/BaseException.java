package com.repledger.exception;

import java.util.Map;
import lombok.Getter;

/**
 * Root of every ledger failure. A failed operation has already been rolled back by the time
 * one of these escapes {@code LoanLedger}; GlobalExceptionHandler turns the code and the
 * details (loan id, conflict, risk reason) into the error body.
 */
@Getter
public abstract class BaseException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    protected BaseException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
        this.details = Map.of();
    }

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(message);
        this.errorCode = errorCode;
        this.details = details != null ? details : Map.of();
    }

    protected BaseException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.details = Map.of();
    }
}
