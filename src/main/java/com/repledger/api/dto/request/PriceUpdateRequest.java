package com.repledger.api.dto.request;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigInteger;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Sets the oracle quote for one directional pair: {@code price / 10^decimals} units of
 * {@code quote} per unit of {@code base}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PriceUpdateRequest {

    @NotBlank(message = "Base asset is required")
    private String base;

    @NotBlank(message = "Quote asset is required")
    private String quote;

    @NotNull(message = "Price is required")
    private BigInteger price;

    @Min(value = 0, message = "Decimals must not be negative")
    private int decimals;
}
