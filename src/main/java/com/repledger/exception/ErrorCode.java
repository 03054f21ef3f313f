package com.repledger.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Wire code and HTTP status per failure kind. Risk rejections and short balances are 422. */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    FORBIDDEN("FORBIDDEN", 403),
    NOT_FOUND("NOT_FOUND", 404),
    STATE_CONFLICT("STATE_CONFLICT", 409),
    POLICY_REJECTION("POLICY_REJECTION", 422),
    INSUFFICIENT_FUNDS("INSUFFICIENT_FUNDS", 422),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),
    REENTRANCY_VIOLATION("REENTRANCY_VIOLATION", 500),
    DEPENDENCY_UNAVAILABLE("DEPENDENCY_UNAVAILABLE", 503);

    private final String code;
    private final int httpStatus;
}
