package com.tradestore.unit.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.tradestore.domain.model.StrategySignal;
import com.tradestore.entity.StrategySignalEntity;
import com.tradestore.mapper.StrategySignalMapper;
import com.tradestore.observability.RecordMetrics;
import com.tradestore.repository.jpa.StrategySignalJpaRepository;
import com.tradestore.service.StrategySignalService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mapstruct.factory.Mappers;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class StrategySignalServiceTest {

    private static final LocalDateTime TICK = LocalDateTime.of(2024, 5, 6, 12, 0, 1);

    @Mock
    private StrategySignalJpaRepository strategySignalJpaRepository;

    private final StrategySignalMapper strategySignalMapper = Mappers.getMapper(StrategySignalMapper.class);
    private StrategySignalService strategySignalService;

    @BeforeEach
    void setUp() {
        strategySignalService = new StrategySignalService(
                strategySignalJpaRepository, strategySignalMapper, new RecordMetrics(new SimpleMeterRegistry()));
    }

    @Test
    @DisplayName("recordSignal: stores metrics as JSON text and returns them as a map")
    void recordSignalStoresMetricsAsJson() {
        when(strategySignalJpaRepository.save(any(StrategySignalEntity.class)))
                .thenAnswer(invocation -> invocation.getArgument(0));

        StrategySignal recorded = strategySignalService.recordSignal(StrategySignal.builder()
                .symbol("BTCUSDT")
                .interval("15m")
                .timestamp(TICK)
                .strategyName("rsi-reversion")
                .signal("buy")
                .confidence(0.8)
                .metrics(Map.of("rsi", 27.5))
                .build());

        ArgumentCaptor<StrategySignalEntity> captor = ArgumentCaptor.forClass(StrategySignalEntity.class);
        verify(strategySignalJpaRepository).save(captor.capture());
        assertThat(captor.getValue().getMetrics()).isEqualTo("{\"rsi\":27.5}");
        assertThat(recorded.getMetrics()).containsEntry("rsi", 27.5);
    }

    @Test
    @DisplayName("listSignals: picks the narrowest query for the given filters")
    void listSignalsByFilters() {
        when(strategySignalJpaRepository.findByStrategyNameOrderByTimestampDescSignalIdDesc("rsi"))
                .thenReturn(List.of(entity(1L, "ETHUSDT"), entity(2L, "BTCUSDT")));
        when(strategySignalJpaRepository.findByStrategyNameAndSymbolOrderByTimestampDescSignalIdDesc("rsi", "BTCUSDT"))
                .thenReturn(List.of(entity(2L, "BTCUSDT")));
        when(strategySignalJpaRepository.findByStrategyNameAndSymbolAndIntervalOrderByTimestampDescSignalIdDesc(
                        "rsi", "BTCUSDT", "1h"))
                .thenReturn(List.of());

        assertThat(strategySignalService.listSignals("rsi", null, null)).hasSize(2);
        assertThat(strategySignalService.listSignals("rsi", "BTCUSDT", null))
                .extracting(StrategySignal::getSignalId)
                .containsExactly(2L);
        assertThat(strategySignalService.listSignals("rsi", "BTCUSDT", "1h")).isEmpty();
    }

    @Test
    @DisplayName("latestSignal: empty when nothing was recorded")
    void latestSignalEmpty() {
        when(strategySignalJpaRepository.findFirstByStrategyNameAndSymbolAndIntervalOrderByTimestampDescSignalIdDesc(
                        "rsi", "BTCUSDT", "1h"))
                .thenReturn(Optional.empty());

        assertThat(strategySignalService.latestSignal("rsi", "BTCUSDT", "1h")).isEmpty();
    }

    private StrategySignalEntity entity(Long id, String symbol) {
        return StrategySignalEntity.builder()
                .signalId(id)
                .symbol(symbol)
                .interval("1h")
                .timestamp(TICK)
                .strategyName("rsi")
                .signal("hold")
                .build();
    }
}
