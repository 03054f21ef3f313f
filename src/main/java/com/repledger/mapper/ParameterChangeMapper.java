package com.repledger.mapper;

import com.repledger.domain.model.ParameterChange;
import com.repledger.entity.ParameterChangeEntity;
import java.util.List;
import org.mapstruct.Mapper;

@Mapper(componentModel = "spring")
public interface ParameterChangeMapper {

    ParameterChange toDomain(ParameterChangeEntity entity);

    List<ParameterChange> toDomainList(List<ParameterChangeEntity> entities);
}
