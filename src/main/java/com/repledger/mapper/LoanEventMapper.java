package com.repledger.mapper;

import com.repledger.domain.model.LoanEventRecord;
import com.repledger.entity.LoanEventEntity;
import java.util.List;
import org.mapstruct.Mapper;

/**
 * Read-side mapper for the loan audit trail. Rows are written by LoanAuditService from the
 * published event, so only entity-to-record mapping is needed.
 */
@Mapper(componentModel = "spring")
public interface LoanEventMapper {

    LoanEventRecord toDomain(LoanEventEntity entity);

    List<LoanEventRecord> toDomainList(List<LoanEventEntity> entities);
}
