package com.repledger.api.dto.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Manual score correction for one account. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReputationUpdateRequest {

    @NotNull(message = "Score is required")
    @PositiveOrZero(message = "Score must not be negative")
    private Integer score;
}
