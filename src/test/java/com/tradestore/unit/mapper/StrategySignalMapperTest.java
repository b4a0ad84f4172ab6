package com.tradestore.unit.mapper;

import static org.assertj.core.api.Assertions.assertThat;

import com.tradestore.api.dto.request.StrategySignalRequest;
import com.tradestore.domain.model.StrategySignal;
import com.tradestore.entity.StrategySignalEntity;
import com.tradestore.mapper.StrategySignalMapper;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mapstruct.factory.Mappers;

/**
 * Unit tests for {@link StrategySignalMapper}.
 * Verifies the metrics map is carried through the JSON text column.
 */
class StrategySignalMapperTest {

    private StrategySignalMapper strategySignalMapper;

    @BeforeEach
    void setUp() {
        strategySignalMapper = Mappers.getMapper(StrategySignalMapper.class);
    }

    @Test
    @DisplayName("toDomain: parses nested metrics JSON into maps and lists")
    void parsesNestedMetrics() {
        StrategySignalEntity entity = StrategySignalEntity.builder()
                .signalId(3L)
                .symbol("BTCUSDT")
                .interval("1h")
                .timestamp(LocalDateTime.of(2024, 6, 1, 10, 0))
                .strategyName("breakout")
                .signal("sell")
                .confidence(0.65)
                .metrics("{\"atr\":312.4,\"levels\":[41000,42500],\"filter\":{\"trend\":\"down\"}}")
                .build();

        StrategySignal signal = strategySignalMapper.toDomain(entity);

        assertThat(signal.getSignalId()).isEqualTo(3L);
        assertThat(signal.getMetrics()).containsEntry("atr", 312.4);
        assertThat(signal.getMetrics().get("levels")).isEqualTo(List.of(41000, 42500));
        assertThat(signal.getMetrics().get("filter")).isEqualTo(Map.of("trend", "down"));
    }

    @Test
    @DisplayName("toEntity: empty or missing metrics are stored as null")
    void emptyMetricsStoredAsNull() {
        StrategySignal withEmpty = StrategySignal.builder().metrics(Map.of()).build();
        StrategySignal withNone = StrategySignal.builder().build();

        assertThat(strategySignalMapper.toEntity(withEmpty).getMetrics()).isNull();
        assertThat(strategySignalMapper.toEntity(withNone).getMetrics()).isNull();
        assertThat(strategySignalMapper.toDomain(StrategySignalEntity.builder().build()).getMetrics()).isNull();
    }

    @Test
    @DisplayName("toDomain(request): never takes a signal id from the caller")
    void requestHasNoId() {
        StrategySignalRequest request = StrategySignalRequest.builder()
                .symbol("ETHUSDT")
                .interval("5m")
                .timestamp(LocalDateTime.of(2024, 6, 1, 10, 5))
                .strategyName("breakout")
                .signal("hold")
                .metrics(Map.of("volume_ratio", 1.2))
                .build();

        StrategySignal signal = strategySignalMapper.toDomain(request);

        assertThat(signal.getSignalId()).isNull();
        assertThat(signal.getMetrics()).containsEntry("volume_ratio", 1.2);
    }
}
