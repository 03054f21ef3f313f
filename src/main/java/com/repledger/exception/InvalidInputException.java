package com.repledger.exception;

public class InvalidInputException extends BaseException {

    public InvalidInputException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }
}
