package com.riskledger.mapper;

import com.riskledger.domain.model.RiskEventRecord;
import com.riskledger.entity.RiskEventEntity;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper
public interface RiskEventMapper {

    /** Details are stored as JSON and decoded by the caller. */
    @Mapping(target = "details", ignore = true)
    RiskEventRecord toRecord(RiskEventEntity entity);
}
