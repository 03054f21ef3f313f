package com.repledger.exception;

public class ReentrancyException extends BaseException {

    public ReentrancyException(String operation) {
        super(ErrorCode.REENTRANCY_VIOLATION, "Reentrant call rejected: " + operation);
    }
}
