package com.repledger.repository.jpa;

import com.repledger.entity.LoanEventEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the loan_events table.
 */
@Repository
public interface LoanEventJpaRepository extends JpaRepository<LoanEventEntity, Long> {

    List<LoanEventEntity> findByLoanIdOrderByIdAsc(long loanId);

    List<LoanEventEntity> findByBorrowerOrderByIdAsc(String borrower);
}
