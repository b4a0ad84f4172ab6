package com.tradestore.mapper;

import com.tradestore.api.dto.request.TradeRequest;
import com.tradestore.api.dto.response.TradeResponse;
import com.tradestore.domain.model.Trade;
import com.tradestore.entity.TradeEntity;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/** MapStruct mapper between Trade, TradeEntity and the trade DTOs. */
@Mapper
public interface TradeMapper {

    TradeEntity toEntity(Trade trade);

    Trade toDomain(TradeEntity entity);

    List<Trade> toDomainList(List<TradeEntity> entities);

    @Mapping(target = "tradeId", ignore = true)
    Trade toDomain(TradeRequest request);

    TradeResponse toResponse(Trade trade);

    List<TradeResponse> toResponseList(List<Trade> trades);
}
