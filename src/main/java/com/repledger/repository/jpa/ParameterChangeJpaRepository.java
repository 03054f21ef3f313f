package com.repledger.repository.jpa;

import com.repledger.entity.ParameterChangeEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the ledger_parameter_history table, queryable by category.
 */
@Repository
public interface ParameterChangeJpaRepository extends JpaRepository<ParameterChangeEntity, Long> {

    @Query("SELECT p FROM ParameterChangeEntity p WHERE p.category = :category ORDER BY p.timestamp DESC")
    List<ParameterChangeEntity> findByCategoryOrderByTimestampDesc(@Param("category") String category);

    List<ParameterChangeEntity> findAllByOrderByTimestampDesc();
}
