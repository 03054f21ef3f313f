package com.repledger.event;

import com.repledger.domain.enums.LoanEventType;
import com.repledger.domain.model.Loan;
import java.util.Map;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Thin wrapper around Spring's {@link ApplicationEventPublisher} with typed factory methods
 * for loan lifecycle events.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    public void publishLoanOpened(Object source, Loan loan, Map<String, Object> details) {
        applicationEventPublisher.publishEvent(
                new LoanEvent(source, loan, LoanEventType.LOAN_OPENED, loan.getBorrower(), details));
    }

    public void publishLoanRepaid(Object source, Loan loan, String payer, boolean closed, Map<String, Object> details) {
        LoanEventType type = closed ? LoanEventType.LOAN_CLOSED : LoanEventType.LOAN_REPAID;
        applicationEventPublisher.publishEvent(new LoanEvent(source, loan, type, payer, details));
    }

    public void publishLoanDefaulted(Object source, Loan loan, String keeper, Map<String, Object> details) {
        applicationEventPublisher.publishEvent(
                new LoanEvent(source, loan, LoanEventType.LOAN_DEFAULTED, keeper, details));
    }
}
