package com.tradestore.mapper;

import com.tradestore.api.dto.request.PositionOpenRequest;
import com.tradestore.api.dto.response.PositionResponse;
import com.tradestore.domain.model.Position;
import com.tradestore.entity.PositionEntity;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper between Position, PositionEntity and the position DTOs.
 *
 * <p>The response's {@code open} flag comes from the derived {@link Position#isOpen()}.
 */
@Mapper
public interface PositionMapper {

    PositionEntity toEntity(Position position);

    Position toDomain(PositionEntity entity);

    List<Position> toDomainList(List<PositionEntity> entities);

    @Mapping(target = "positionId", ignore = true)
    @Mapping(target = "closedAt", ignore = true)
    Position toDomain(PositionOpenRequest request);

    PositionResponse toResponse(Position position);

    List<PositionResponse> toResponseList(List<Position> positions);
}
