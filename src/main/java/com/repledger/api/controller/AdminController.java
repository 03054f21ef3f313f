package com.repledger.api.controller;

import com.repledger.api.dto.request.InterestModelRequest;
import com.repledger.api.dto.request.MintRequest;
import com.repledger.api.dto.request.ParameterUpdateRequest;
import com.repledger.api.dto.request.PriceUpdateRequest;
import com.repledger.api.dto.request.ReputationUpdateRequest;
import com.repledger.api.dto.response.BalanceResponse;
import com.repledger.api.dto.response.ParametersResponse;
import com.repledger.audit.ParameterHistoryService;
import com.repledger.custody.AssetCustody;
import com.repledger.domain.model.ParameterChange;
import com.repledger.domain.model.PriceQuote;
import com.repledger.exception.InvalidInputException;
import com.repledger.interest.LinearInterestModel;
import com.repledger.ledger.LedgerAdminService;
import com.repledger.ledger.LoanLedger;
import com.repledger.risk.RiskParameters;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Administrative endpoints. Every call requires an admin account in the {@code X-Account} header.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>POST /api/admin/pause, POST /api/admin/unpause -- emergency switch for loan operations</li>
 *   <li>GET /api/admin/parameters -- current ledger and risk parameters</li>
 *   <li>PUT /api/admin/parameters -- partial update, only non-null fields are applied</li>
 *   <li>GET /api/admin/parameters/history -- audit trail, optionally filtered by category</li>
 *   <li>PUT /api/admin/interest-model -- swap in a linear model with new rates</li>
 *   <li>PUT /api/admin/prices -- set an oracle quote</li>
 *   <li>DELETE /api/admin/prices/{base}/{quote} -- remove an oracle quote</li>
 *   <li>PUT /api/admin/reputation/{account} -- correct an account's score</li>
 *   <li>POST /api/admin/assets/mint -- fund an account</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/admin")
public class AdminController {

    private static final Logger log = LoggerFactory.getLogger(AdminController.class);

    private final LedgerAdminService ledgerAdminService;
    private final LoanLedger loanLedger;
    private final RiskParameters riskParameters;
    private final ParameterHistoryService parameterHistoryService;
    private final AssetCustody assetCustody;

    public AdminController(
            LedgerAdminService ledgerAdminService,
            LoanLedger loanLedger,
            RiskParameters riskParameters,
            ParameterHistoryService parameterHistoryService,
            AssetCustody assetCustody) {
        this.ledgerAdminService = ledgerAdminService;
        this.loanLedger = loanLedger;
        this.riskParameters = riskParameters;
        this.parameterHistoryService = parameterHistoryService;
        this.assetCustody = assetCustody;
    }

    @PostMapping("/pause")
    public ResponseEntity<Map<String, Object>> pause(@RequestHeader(LoanController.ACCOUNT_HEADER) String account) {
        ledgerAdminService.pause(account);
        return ResponseEntity.ok(Map.of("paused", true));
    }

    @PostMapping("/unpause")
    public ResponseEntity<Map<String, Object>> unpause(@RequestHeader(LoanController.ACCOUNT_HEADER) String account) {
        ledgerAdminService.unpause(account);
        return ResponseEntity.ok(Map.of("paused", false));
    }

    @GetMapping("/parameters")
    public ResponseEntity<ParametersResponse> getParameters(
            @RequestHeader(LoanController.ACCOUNT_HEADER) String account) {
        ledgerAdminService.requireAdmin(account);
        return ResponseEntity.ok(currentParameters());
    }

    /**
     * Applies each non-null field through {@link LedgerAdminService}, in declaration order.
     * A failing field aborts the rest; fields applied before it stay applied.
     */
    @PutMapping("/parameters")
    public ResponseEntity<ParametersResponse> updateParameters(
            @RequestHeader(LoanController.ACCOUNT_HEADER) String account,
            @Valid @RequestBody ParameterUpdateRequest request) {
        ledgerAdminService.requireAdmin(account);
        log.info("Parameter update requested by {}", account);

        if (request.getOriginationFeeBps() != null) {
            ledgerAdminService.setOriginationFeeBps(account, request.getOriginationFeeBps());
        }
        if (request.getProtocolFeeBps() != null) {
            ledgerAdminService.setProtocolFeeBps(account, request.getProtocolFeeBps());
        }
        if (request.getDefaultBountyBps() != null) {
            ledgerAdminService.setDefaultBountyBps(account, request.getDefaultBountyBps());
        }
        if (request.getMinDurationSeconds() != null || request.getMaxDurationSeconds() != null) {
            if (request.getMinDurationSeconds() == null || request.getMaxDurationSeconds() == null) {
                throw new InvalidInputException("minDurationSeconds and maxDurationSeconds must be set together");
            }
            ledgerAdminService.setDurationBounds(
                    account, request.getMinDurationSeconds(), request.getMaxDurationSeconds());
        }
        if (request.getGracePeriodSeconds() != null) {
            ledgerAdminService.setGracePeriodSeconds(account, request.getGracePeriodSeconds());
        }
        if (request.getTreasuryAccount() != null) {
            ledgerAdminService.setTreasuryAccount(account, request.getTreasuryAccount());
        }
        if (request.getMaxRatioBps() != null) {
            ledgerAdminService.setMaxRatioBps(account, request.getMaxRatioBps());
        }
        if (request.getScoreFree() != null) {
            ledgerAdminService.setScoreFree(account, request.getScoreFree());
        }
        if (request.getNoCollateralCap() != null) {
            ledgerAdminService.setNoCollateralCap(account, request.getNoCollateralCap());
        }
        if (request.getProofRequired() != null) {
            ledgerAdminService.setProofRequired(account, request.getProofRequired());
        }
        return ResponseEntity.ok(currentParameters());
    }

    @GetMapping("/parameters/history")
    public ResponseEntity<List<ParameterChange>> getHistory(
            @RequestHeader(LoanController.ACCOUNT_HEADER) String account,
            @RequestParam(required = false) String category) {
        ledgerAdminService.requireAdmin(account);
        List<ParameterChange> history = category != null
                ? parameterHistoryService.getHistoryByCategory(category)
                : parameterHistoryService.getAllHistory();
        return ResponseEntity.ok(history);
    }

    @PutMapping("/interest-model")
    public ResponseEntity<ParametersResponse> setInterestModel(
            @RequestHeader(LoanController.ACCOUNT_HEADER) String account,
            @Valid @RequestBody InterestModelRequest request) {
        ledgerAdminService.setInterestModel(
                account, new LinearInterestModel(request.getAprBps(), request.getPenaltyAprBps()));
        return ResponseEntity.ok(currentParameters());
    }

    @PutMapping("/prices")
    public ResponseEntity<PriceQuote> setPrice(
            @RequestHeader(LoanController.ACCOUNT_HEADER) String account,
            @Valid @RequestBody PriceUpdateRequest request) {
        PriceQuote quote = new PriceQuote(request.getPrice(), request.getDecimals());
        ledgerAdminService.setPrice(account, request.getBase(), request.getQuote(), quote);
        return ResponseEntity.ok(quote);
    }

    @DeleteMapping("/prices/{base}/{quote}")
    public ResponseEntity<Map<String, Object>> removePrice(
            @RequestHeader(LoanController.ACCOUNT_HEADER) String account,
            @PathVariable String base,
            @PathVariable String quote) {
        ledgerAdminService.removePrice(account, base, quote);
        return ResponseEntity.ok(Map.of("base", base, "quote", quote, "removed", true));
    }

    @PutMapping("/reputation/{target}")
    public ResponseEntity<Map<String, Object>> setReputationScore(
            @RequestHeader(LoanController.ACCOUNT_HEADER) String account,
            @PathVariable String target,
            @Valid @RequestBody ReputationUpdateRequest request) {
        ledgerAdminService.setReputationScore(account, target, request.getScore());
        return ResponseEntity.ok(Map.of("account", target, "score", request.getScore()));
    }

    @PostMapping("/assets/mint")
    public ResponseEntity<BalanceResponse> mint(
            @RequestHeader(LoanController.ACCOUNT_HEADER) String account, @Valid @RequestBody MintRequest request) {
        ledgerAdminService.mint(account, request.getAsset(), request.getOwner(), request.getAmount());
        return ResponseEntity.ok(BalanceResponse.builder()
                .asset(request.getAsset())
                .owner(request.getOwner())
                .balance(assetCustody.balanceOf(request.getAsset(), request.getOwner()))
                .build());
    }

    private ParametersResponse currentParameters() {
        return ParametersResponse.builder()
                .ledger(loanLedger.getLedgerParameters())
                .risk(riskParameters)
                .interestModel(loanLedger.getInterestModel().map(Object::toString).orElse(null))
                .build();
    }
}
