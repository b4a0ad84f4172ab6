package com.tradestore.mapper;

import com.tradestore.api.dto.request.PriceBarRequest;
import com.tradestore.api.dto.response.PriceDatumResponse;
import com.tradestore.domain.model.PriceDatum;
import com.tradestore.entity.PriceDataEntity;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper for price bars.
 *
 * <p>A bar in a request carries no symbol or interval; those come once per series and are
 * stamped onto every bar by PriceDataService.
 */
@Mapper
public interface PriceDataMapper {

    PriceDataEntity toEntity(PriceDatum priceDatum);

    List<PriceDataEntity> toEntityList(List<PriceDatum> priceData);

    PriceDatum toDomain(PriceDataEntity entity);

    List<PriceDatum> toDomainList(List<PriceDataEntity> entities);

    @Mapping(target = "id", ignore = true)
    @Mapping(target = "symbol", ignore = true)
    @Mapping(target = "interval", ignore = true)
    PriceDatum toDomain(PriceBarRequest request);

    List<PriceDatum> toDomainBars(List<PriceBarRequest> requests);

    PriceDatumResponse toResponse(PriceDatum priceDatum);

    List<PriceDatumResponse> toResponseList(List<PriceDatum> priceData);
}
