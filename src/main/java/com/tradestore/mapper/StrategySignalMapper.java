package com.tradestore.mapper;

import com.tradestore.api.dto.request.StrategySignalRequest;
import com.tradestore.api.dto.response.StrategySignalResponse;
import com.tradestore.domain.model.StrategySignal;
import com.tradestore.entity.StrategySignalEntity;
import java.util.List;
import java.util.Map;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

/**
 * MapStruct mapper for strategy signals.
 *
 * <p>The domain model holds metrics as a map; the entity stores it as a JSON text blob.
 * An empty map is stored as null so "no metrics" has a single representation.
 */
@Mapper
public interface StrategySignalMapper {

    @Mapping(target = "metrics", source = "metrics", qualifiedByName = "metricsToJson")
    StrategySignalEntity toEntity(StrategySignal signal);

    @Mapping(target = "metrics", source = "metrics", qualifiedByName = "metricsFromJson")
    StrategySignal toDomain(StrategySignalEntity entity);

    List<StrategySignal> toDomainList(List<StrategySignalEntity> entities);

    @Mapping(target = "signalId", ignore = true)
    StrategySignal toDomain(StrategySignalRequest request);

    StrategySignalResponse toResponse(StrategySignal signal);

    List<StrategySignalResponse> toResponseList(List<StrategySignal> signals);

    @Named("metricsToJson")
    default String metricsToJson(Map<String, Object> metrics) {
        return MetricsJson.write(metrics);
    }

    @Named("metricsFromJson")
    default Map<String, Object> metricsFromJson(String json) {
        return MetricsJson.read(json);
    }
}
