package com.repledger.domain.model;

import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

/**
 * Audit trail entry for an administrative parameter change (fee rate, duration bound, pause flag, module swap).
 */
@Data
@Builder
public class ParameterChange {

    private Long id;

    /** Category: LEDGER, RISK, MODULE, PRICE, REPUTATION. */
    private String category;

    private String name;
    private String oldValue;
    private String newValue;
    private String changedBy;
    private LocalDateTime timestamp;
}
