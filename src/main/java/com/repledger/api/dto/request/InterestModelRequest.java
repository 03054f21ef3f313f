package com.repledger.api.dto.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Replaces the active interest model with a linear model at the given rates. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InterestModelRequest {

    @NotNull(message = "aprBps is required")
    @PositiveOrZero(message = "aprBps must not be negative")
    private Integer aprBps;

    @NotNull(message = "penaltyAprBps is required")
    @PositiveOrZero(message = "penaltyAprBps must not be negative")
    private Integer penaltyAprBps;
}
