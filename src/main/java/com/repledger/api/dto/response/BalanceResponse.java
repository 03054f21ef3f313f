package com.repledger.api.dto.response;

import java.math.BigInteger;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class BalanceResponse {

    private final String asset;
    private final String owner;
    private final BigInteger balance;
}
