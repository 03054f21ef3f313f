package com.repledger.entity;

import com.repledger.domain.enums.LoanEventType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the loan_events table.
 * Append-only history of committed loan lifecycle events. Amounts live in details_json
 * so the table does not need a column per event type.
 */
@Entity
@Table(
        name = "loan_events",
        indexes = {
            @Index(name = "idx_loan_events_loan", columnList = "loan_id"),
            @Index(name = "idx_loan_events_borrower", columnList = "borrower")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LoanEventEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "loan_id", nullable = false)
    private long loanId;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", length = 30, nullable = false)
    private LoanEventType eventType;

    @Column(length = 100)
    private String borrower;

    /** Borrower, payer or keeper that triggered the event. */
    @Column(length = 100)
    private String actor;

    @Column(name = "details_json", columnDefinition = "TEXT")
    private String detailsJson;

    private LocalDateTime timestamp;
}
