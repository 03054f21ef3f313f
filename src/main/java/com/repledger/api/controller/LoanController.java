package com.repledger.api.controller;

import com.repledger.api.dto.request.OpenLoanRequest;
import com.repledger.api.dto.request.RepayRequest;
import com.repledger.api.dto.response.DebtResponse;
import com.repledger.api.dto.response.LoanResponse;
import com.repledger.api.dto.response.RepaymentResponse;
import com.repledger.audit.LoanAuditService;
import com.repledger.domain.model.Loan;
import com.repledger.domain.model.LoanEventRecord;
import com.repledger.domain.model.RepaymentResult;
import com.repledger.ledger.LoanLedger;
import com.repledger.mapper.LoanDtoMapper;
import jakarta.validation.Valid;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for the loan lifecycle.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>POST /api/loans -- open a loan for the caller</li>
 *   <li>POST /api/loans/{id}/repay -- repay (caller must be the borrower)</li>
 *   <li>POST /api/loans/{id}/default -- mark an overdue loan defaulted, caller receives the bounty</li>
 *   <li>GET /api/loans/{id} -- loan details</li>
 *   <li>GET /api/loans/{id}/debt -- current debt and outstanding amount</li>
 *   <li>GET /api/loans/borrower/{borrower} -- all loans of a borrower</li>
 *   <li>GET /api/loans/{id}/events -- persisted lifecycle events</li>
 *   <li>GET /api/loans/borrower/{borrower}/events -- persisted events across a borrower's loans</li>
 * </ul>
 *
 * <p>The caller's account is taken from the {@code X-Account} header.
 */
@RestController
@RequestMapping("/api/loans")
public class LoanController {

    static final String ACCOUNT_HEADER = "X-Account";

    private static final Logger log = LoggerFactory.getLogger(LoanController.class);

    private final LoanLedger loanLedger;
    private final LoanAuditService loanAuditService;
    private final LoanDtoMapper loanDtoMapper;

    public LoanController(LoanLedger loanLedger, LoanAuditService loanAuditService, LoanDtoMapper loanDtoMapper) {
        this.loanLedger = loanLedger;
        this.loanAuditService = loanAuditService;
        this.loanDtoMapper = loanDtoMapper;
    }

    @PostMapping
    public ResponseEntity<LoanResponse> openLoan(
            @RequestHeader(ACCOUNT_HEADER) String account, @Valid @RequestBody OpenLoanRequest request) {
        log.info("Open loan requested by {}: {} {}", account, request.getAmount(), request.getAsset());
        long loanId = loanLedger.open(account, loanDtoMapper.toBorrowRequest(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(toResponse(loanLedger.getLoan(loanId)));
    }

    @PostMapping("/{id}/repay")
    public ResponseEntity<RepaymentResponse> repay(
            @RequestHeader(ACCOUNT_HEADER) String account,
            @PathVariable long id,
            @Valid @RequestBody RepayRequest request) {
        RepaymentResult result = loanLedger.repay(account, id, request.getAmount());
        return ResponseEntity.ok(RepaymentResponse.builder()
                .loanId(id)
                .paidNet(result.paidNet())
                .totalRepaid(result.totalRepaid())
                .totalDebt(result.totalDebt())
                .fullyRepaid(result.fullyRepaid())
                .build());
    }

    @PostMapping("/{id}/default")
    public ResponseEntity<LoanResponse> markDefault(
            @RequestHeader(ACCOUNT_HEADER) String account, @PathVariable long id) {
        Loan loan = loanLedger.markDefault(account, id);
        return ResponseEntity.ok(toResponse(loan));
    }

    @GetMapping("/{id}")
    public ResponseEntity<LoanResponse> getLoan(@PathVariable long id) {
        return ResponseEntity.ok(toResponse(loanLedger.getLoan(id)));
    }

    @GetMapping("/{id}/debt")
    public ResponseEntity<DebtResponse> getDebt(@PathVariable long id) {
        Loan loan = loanLedger.getLoan(id);
        return ResponseEntity.ok(DebtResponse.builder()
                .loanId(id)
                .status(loan.getStatus())
                .debt(loanLedger.getDebt(id))
                .outstanding(loanLedger.getOutstanding(id))
                .build());
    }

    @GetMapping("/borrower/{borrower}")
    public ResponseEntity<List<LoanResponse>> getLoansOf(@PathVariable String borrower) {
        return ResponseEntity.ok(
                loanLedger.getLoansOf(borrower).stream().map(this::toResponse).toList());
    }

    @GetMapping("/borrower/{borrower}/events")
    public ResponseEntity<List<LoanEventRecord>> getBorrowerEvents(@PathVariable String borrower) {
        return ResponseEntity.ok(loanAuditService.getBorrowerHistory(borrower));
    }

    @GetMapping("/{id}/events")
    public ResponseEntity<List<LoanEventRecord>> getEvents(@PathVariable long id) {
        loanLedger.getLoan(id);
        return ResponseEntity.ok(loanAuditService.getLoanHistory(id));
    }

    private LoanResponse toResponse(Loan loan) {
        LoanResponse response = loanDtoMapper.toResponse(loan);
        response.setOutstanding(loanLedger.getOutstanding(loan.getId()));
        return response;
    }
}
