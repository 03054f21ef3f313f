package com.repledger.api.controller;

import com.repledger.api.dto.request.OpenLoanRequest;
import com.repledger.api.dto.response.CollateralRatioResponse;
import com.repledger.api.dto.response.RiskAssessmentResponse;
import com.repledger.exception.DependencyUnavailableException;
import com.repledger.ledger.LoanLedger;
import com.repledger.mapper.LoanDtoMapper;
import com.repledger.reputation.ReputationStore;
import com.repledger.risk.RiskPolicy;
import com.repledger.risk.RiskResult;
import jakarta.validation.Valid;
import java.util.Optional;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only access to the risk policy the ledger is currently using.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>POST /api/risk/assess -- dry-run a borrow request for the caller</li>
 *   <li>GET /api/risk/ratio/{borrower} -- required collateral ratio and score</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/risk")
public class RiskController {

    private final LoanLedger loanLedger;
    private final Optional<ReputationStore> reputationStore;
    private final LoanDtoMapper loanDtoMapper;

    public RiskController(
            LoanLedger loanLedger, Optional<ReputationStore> reputationStore, LoanDtoMapper loanDtoMapper) {
        this.loanLedger = loanLedger;
        this.reputationStore = reputationStore;
        this.loanDtoMapper = loanDtoMapper;
    }

    @PostMapping("/assess")
    public ResponseEntity<RiskAssessmentResponse> assess(
            @RequestHeader(LoanController.ACCOUNT_HEADER) String account,
            @Valid @RequestBody OpenLoanRequest request) {
        RiskResult result = currentPolicy().assessBorrow(account, loanDtoMapper.toBorrowRequest(request));
        return ResponseEntity.ok(RiskAssessmentResponse.builder()
                .borrower(account)
                .allowed(result.isAllowed())
                .reason(result.getReason())
                .collateralRatioBps(result.getCollateralRatioBps())
                .maxBorrow(result.getMaxBorrow())
                .build());
    }

    @GetMapping("/ratio/{borrower}")
    public ResponseEntity<CollateralRatioResponse> getRatio(@PathVariable String borrower) {
        RiskPolicy policy = currentPolicy();
        return ResponseEntity.ok(CollateralRatioResponse.builder()
                .borrower(borrower)
                .score(reputationStore.map(store -> store.scoreOf(borrower)).orElse(null))
                .defaulter(policy.isDefaulter(borrower))
                .collateralRatioBps(policy.collateralRatioBps(borrower))
                .build());
    }

    private RiskPolicy currentPolicy() {
        return loanLedger.getRiskPolicy().orElseThrow(() -> new DependencyUnavailableException("risk policy"));
    }
}
