package com.tradestore.mapper;

import com.tradestore.api.dto.request.PortfolioSnapshotRequest;
import com.tradestore.api.dto.response.PortfolioHistoryResponse;
import com.tradestore.domain.model.PortfolioHistoryRecord;
import com.tradestore.entity.PortfolioHistoryEntity;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/** MapStruct mapper for portfolio valuation snapshots. */
@Mapper
public interface PortfolioHistoryMapper {

    PortfolioHistoryEntity toEntity(PortfolioHistoryRecord record);

    PortfolioHistoryRecord toDomain(PortfolioHistoryEntity entity);

    List<PortfolioHistoryRecord> toDomainList(List<PortfolioHistoryEntity> entities);

    @Mapping(target = "recordId", ignore = true)
    PortfolioHistoryRecord toDomain(PortfolioSnapshotRequest request);

    PortfolioHistoryResponse toResponse(PortfolioHistoryRecord record);

    List<PortfolioHistoryResponse> toResponseList(List<PortfolioHistoryRecord> records);
}
