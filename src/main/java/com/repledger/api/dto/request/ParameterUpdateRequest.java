package com.repledger.api.dto.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigInteger;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial update of ledger and risk parameters. Only non-null fields are applied;
 * duration bounds must be sent together.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParameterUpdateRequest {

    @Min(value = 0, message = "Fee must be between 0 and 10000 bps")
    @Max(value = 10000, message = "Fee must be between 0 and 10000 bps")
    private Integer originationFeeBps;

    @Min(value = 0, message = "Fee must be between 0 and 10000 bps")
    @Max(value = 10000, message = "Fee must be between 0 and 10000 bps")
    private Integer protocolFeeBps;

    @Min(value = 0, message = "Bounty must be between 0 and 10000 bps")
    @Max(value = 10000, message = "Bounty must be between 0 and 10000 bps")
    private Integer defaultBountyBps;

    @Positive(message = "Minimum duration must be positive")
    private Long minDurationSeconds;

    @Positive(message = "Maximum duration must be positive")
    private Long maxDurationSeconds;

    @PositiveOrZero(message = "Grace period must not be negative")
    private Long gracePeriodSeconds;

    private String treasuryAccount;

    @PositiveOrZero(message = "Max ratio must not be negative")
    private Integer maxRatioBps;

    @Positive(message = "scoreFree must be positive")
    private Integer scoreFree;

    @PositiveOrZero(message = "No-collateral cap must not be negative")
    private BigInteger noCollateralCap;

    private Boolean proofRequired;
}
