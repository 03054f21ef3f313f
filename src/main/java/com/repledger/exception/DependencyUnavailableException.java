package com.repledger.exception;

public class DependencyUnavailableException extends BaseException {

    public DependencyUnavailableException(String dependency) {
        super(ErrorCode.DEPENDENCY_UNAVAILABLE, "Required dependency not configured: " + dependency);
    }
}
