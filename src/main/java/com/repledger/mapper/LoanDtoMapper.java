package com.repledger.mapper;

import com.repledger.api.dto.request.OpenLoanRequest;
import com.repledger.api.dto.response.LoanResponse;
import com.repledger.domain.model.BorrowRequest;
import com.repledger.domain.model.Loan;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper between the loan REST DTOs and the ledger's domain types.
 */
@Mapper(componentModel = "spring")
public interface LoanDtoMapper {

    BorrowRequest toBorrowRequest(OpenLoanRequest request);

    /** {@code outstanding} depends on the clock and is filled in by the caller. */
    @Mapping(target = "outstanding", ignore = true)
    LoanResponse toResponse(Loan loan);
}
