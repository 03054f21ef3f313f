package com.repledger.api.dto.response;

import com.repledger.domain.enums.LoanStatus;
import java.math.BigInteger;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Loan view returned by the loan endpoints. {@code outstanding} is computed at request time
 * and is zero once the loan is closed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LoanResponse {

    private long id;
    private String borrower;
    private String asset;
    private String collateralAsset;
    private BigInteger principal;
    private BigInteger principalRepaid;
    private BigInteger collateralAmount;
    private BigInteger originationFee;
    private long startTs;
    private long dueTs;
    private Long closedTs;
    private LoanStatus status;
    private BigInteger outstanding;
}
