package com.repledger.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigInteger;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for opening a loan and for dry-run risk assessment. The borrower is taken
 * from the {@code X-Account} header, never from the body.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OpenLoanRequest {

    @NotBlank(message = "Asset is required")
    private String asset;

    @NotNull(message = "Amount is required")
    @Positive(message = "Amount must be positive")
    private BigInteger amount;

    /** Omit together with collateralAmount for a collateral-free request. */
    private String collateralAsset;

    @PositiveOrZero(message = "Collateral amount must not be negative")
    private BigInteger collateralAmount;

    @NotNull(message = "Duration is required")
    @Positive(message = "Duration must be positive")
    private Long durationSeconds;

    private String proof;
}
