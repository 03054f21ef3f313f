package com.repledger.api.controller;

import com.repledger.api.dto.response.LedgerStatusResponse;
import com.repledger.api.dto.response.LiquidityResponse;
import com.repledger.custody.AssetCustody;
import com.repledger.ledger.LedgerParameters;
import com.repledger.ledger.LoanLedger;
import java.util.Optional;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Ledger-wide state for operators and dashboards.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/ledger/status -- pause flag, counters, locked collateral, active modules</li>
 *   <li>GET /api/ledger/liquidity/{asset} -- ledger balance, escrowed and free amounts</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/ledger")
public class LedgerController {

    private final LoanLedger loanLedger;
    private final AssetCustody assetCustody;

    public LedgerController(LoanLedger loanLedger, AssetCustody assetCustody) {
        this.loanLedger = loanLedger;
        this.assetCustody = assetCustody;
    }

    @GetMapping("/status")
    public ResponseEntity<LedgerStatusResponse> getStatus() {
        LedgerParameters params = loanLedger.getLedgerParameters();
        return ResponseEntity.ok(LedgerStatusResponse.builder()
                .paused(loanLedger.isPaused())
                .activeLoanCount(loanLedger.getActiveLoanCount())
                .nextLoanId(loanLedger.getNextLoanId())
                .lockedCollateral(loanLedger.getLockedCollateralByAsset())
                .ledgerAccount(params.getLedgerAccount())
                .treasuryAccount(params.getTreasuryAccount())
                .riskPolicy(describe(loanLedger.getRiskPolicy()))
                .interestModel(describe(loanLedger.getInterestModel()))
                .reputationHook(describe(loanLedger.getReputationHook()))
                .build());
    }

    @GetMapping("/liquidity/{asset}")
    public ResponseEntity<LiquidityResponse> getLiquidity(@PathVariable String asset) {
        return ResponseEntity.ok(LiquidityResponse.builder()
                .asset(asset)
                .balance(assetCustody.balanceOf(asset, loanLedger.getLedgerParameters().getLedgerAccount()))
                .lockedCollateral(loanLedger.getLockedCollateral(asset))
                .free(loanLedger.getFreeLiquidity(asset))
                .build());
    }

    private static String describe(Optional<?> module) {
        return module.map(m -> m.getClass().getSimpleName()).orElse(null);
    }
}
