package com.repledger.audit;

import com.repledger.domain.model.Loan;
import com.repledger.domain.model.LoanEventRecord;
import com.repledger.entity.LoanEventEntity;
import com.repledger.event.LoanEvent;
import com.repledger.mapper.JsonHelper;
import com.repledger.mapper.LoanEventMapper;
import com.repledger.repository.jpa.LoanEventJpaRepository;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Persists committed loan events to H2 and serves the per-loan and per-borrower history.
 *
 * <p>Runs on the {@code eventExecutor} pool so a slow or failing database never holds the
 * ledger lock or turns a committed ledger operation into an error for the caller.
 */
@Service
public class LoanAuditService {

    private static final Logger log = LoggerFactory.getLogger(LoanAuditService.class);

    private final LoanEventJpaRepository loanEventJpaRepository;
    private final LoanEventMapper loanEventMapper;

    public LoanAuditService(LoanEventJpaRepository loanEventJpaRepository, LoanEventMapper loanEventMapper) {
        this.loanEventJpaRepository = loanEventJpaRepository;
        this.loanEventMapper = loanEventMapper;
    }

    @Async("eventExecutor")
    @EventListener
    public void onLoanEvent(LoanEvent event) {
        record(event);
    }

    /**
     * Writes one loan_events row for {@code event}. Amounts are stored as strings so
     * arbitrarily large values survive the JSON round trip.
     */
    public void record(LoanEvent event) {
        Loan loan = event.getLoan();
        Map<String, Object> details = new TreeMap<>();
        event.getDetails().forEach((key, value) -> details.put(key, String.valueOf(value)));
        details.put("status", loan.getStatus().name());

        LoanEventEntity entity = LoanEventEntity.builder()
                .loanId(loan.getId())
                .eventType(event.getEventType())
                .borrower(loan.getBorrower())
                .actor(event.getActor())
                .detailsJson(JsonHelper.toJson(details))
                .timestamp(LocalDateTime.now())
                .build();
        loanEventJpaRepository.save(entity);
        log.debug("Recorded {} for loan {}", event.getEventType(), loan.getId());
    }

    public List<LoanEventRecord> getLoanHistory(long loanId) {
        return loanEventMapper.toDomainList(loanEventJpaRepository.findByLoanIdOrderByIdAsc(loanId));
    }

    public List<LoanEventRecord> getBorrowerHistory(String borrower) {
        return loanEventMapper.toDomainList(loanEventJpaRepository.findByBorrowerOrderByIdAsc(borrower));
    }
}
