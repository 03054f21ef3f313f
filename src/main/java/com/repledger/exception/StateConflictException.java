package com.repledger.exception;

import java.util.Map;
import lombok.Getter;

/**
 * The requested transition is not legal for the current ledger or loan state.
 */
@Getter
public class StateConflictException extends BaseException {

    public enum Conflict {
        LEDGER_PAUSED,
        LOAN_ALREADY_ACTIVE,
        LOAN_NOT_ACTIVE,
        NOT_PAST_DUE
    }

    private final Conflict conflict;

    public StateConflictException(Conflict conflict, String message) {
        super(ErrorCode.STATE_CONFLICT, message, Map.of("conflict", conflict.name()));
        this.conflict = conflict;
    }
}
