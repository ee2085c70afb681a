package com.riskledger.mapper;

import com.riskledger.domain.model.Position;
import com.riskledger.entity.PositionEntity;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper between the ledger's {@link Position} and {@link PositionEntity}.
 * The entity's session id, surrogate id and update time are set by the persistence service.
 */
@Mapper
public interface PositionMapper {

    @Mapping(target = "id", ignore = true)
    @Mapping(target = "sessionId", ignore = true)
    @Mapping(target = "updatedAt", ignore = true)
    PositionEntity toEntity(Position position);

    Position toDomain(PositionEntity entity);

    List<Position> toDomainList(List<PositionEntity> entities);
}
