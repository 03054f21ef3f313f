package com.repledger.exception;

public class UnauthorizedException extends BaseException {

    public UnauthorizedException(String message) {
        super(ErrorCode.FORBIDDEN, message);
    }
}
