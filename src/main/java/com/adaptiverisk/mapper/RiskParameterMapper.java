package com.adaptiverisk.mapper;

import com.adaptiverisk.domain.model.RiskParameter;
import com.adaptiverisk.entity.RiskParameterEntity;
import java.util.List;
import org.mapstruct.Mapper;

/**
 * MapStruct mapper between RiskParameter domain model and RiskParameterEntity.
 */
@Mapper
public interface RiskParameterMapper {

    RiskParameterEntity toEntity(RiskParameter riskParameter);

    RiskParameter toDomain(RiskParameterEntity entity);

    List<RiskParameter> toDomainList(List<RiskParameterEntity> entities);
}
