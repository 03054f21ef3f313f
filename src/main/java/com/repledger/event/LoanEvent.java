package com.repledger.event;

import com.repledger.domain.enums.LoanEventType;
import com.repledger.domain.model.Loan;
import java.util.HashMap;
import java.util.Map;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the LoanLedger after an open, repay or default operation has committed.
 * Never published for an operation that was rolled back.
 *
 * <p>Key listeners:
 * <ul>
 *   <li>LoanAuditService -- persists the event to the loan_events table</li>
 * </ul>
 */
public class LoanEvent extends ApplicationEvent {

    private final Loan loan;
    private final LoanEventType eventType;
    private final String actor;
    private final Map<String, Object> details;

    /**
     * @param source    the component publishing this event
     * @param loan      snapshot of the loan after the operation
     * @param eventType what happened
     * @param actor     account that triggered the operation
     * @param details   event-specific amounts (payment, refund, bounty, fees)
     */
    public LoanEvent(Object source, Loan loan, LoanEventType eventType, String actor, Map<String, Object> details) {
        super(source);
        this.loan = loan;
        this.eventType = eventType;
        this.actor = actor;
        this.details = details != null ? new HashMap<>(details) : new HashMap<>();
    }

    public Loan getLoan() {
        return loan;
    }

    public LoanEventType getEventType() {
        return eventType;
    }

    public String getActor() {
        return actor;
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}
