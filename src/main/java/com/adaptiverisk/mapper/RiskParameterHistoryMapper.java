package com.adaptiverisk.mapper;

import com.adaptiverisk.domain.model.RiskParameterHistory;
import com.adaptiverisk.entity.RiskParameterHistoryEntity;
import java.util.List;
import org.mapstruct.Mapper;

/**
 * MapStruct mapper between RiskParameterHistory domain model and RiskParameterHistoryEntity.
 * Straightforward 1:1 field mapping.
 */
@Mapper
public interface RiskParameterHistoryMapper {

    RiskParameterHistoryEntity toEntity(RiskParameterHistory history);

    RiskParameterHistory toDomain(RiskParameterHistoryEntity entity);

    List<RiskParameterHistory> toDomainList(List<RiskParameterHistoryEntity> entities);
}
