package com.repledger.domain.model;

import com.repledger.domain.enums.LoanEventType;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

/**
 * Persisted history entry for a loan lifecycle event.
 */
@Data
@Builder
public class LoanEventRecord {

    private Long id;
    private long loanId;
    private LoanEventType eventType;
    private String borrower;

    /** Account that triggered the event (borrower, payer or keeper). */
    private String actor;

    /** Event-specific amounts serialized as JSON. */
    private String detailsJson;

    private LocalDateTime timestamp;
}
