package com.repledger.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the ledger_parameter_history table.
 * Audit trail for every administrative change (fee rate changed from 50 to 75 bps, ledger paused, etc.).
 */
@Entity
@Table(name = "ledger_parameter_history")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ParameterChangeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /** LEDGER, RISK, MODULE, PRICE, REPUTATION. */
    @Column(length = 30)
    private String category;

    @Column(length = 100)
    private String name;

    @Column(name = "old_value", length = 255)
    private String oldValue;

    @Column(name = "new_value", length = 255)
    private String newValue;

    @Column(name = "changed_by", length = 100)
    private String changedBy;

    private LocalDateTime timestamp;
}
