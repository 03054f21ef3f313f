package com.repledger.api.dto.response;

import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class CollateralRatioResponse {

    private final String borrower;
    private final Integer score;
    private final boolean defaulter;
    private final int collateralRatioBps;
}
