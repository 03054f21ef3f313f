package com.repledger.api.dto.response;

import com.repledger.ledger.LedgerParameters;
import com.repledger.risk.RiskParameters;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class ParametersResponse {

    private final LedgerParameters ledger;
    private final RiskParameters risk;
    private final String interestModel;
}
