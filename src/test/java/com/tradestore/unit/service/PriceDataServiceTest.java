package com.tradestore.unit.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.tradestore.config.StoreConfig;
import com.tradestore.domain.model.PriceDatum;
import com.tradestore.entity.PriceDataEntity;
import com.tradestore.exception.BusinessException;
import com.tradestore.exception.ErrorCode;
import com.tradestore.mapper.PriceDataMapper;
import com.tradestore.observability.RecordMetrics;
import com.tradestore.repository.jpa.PriceDataJpaRepository;
import com.tradestore.service.PriceDataService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mapstruct.factory.Mappers;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Unit tests for {@link PriceDataService}.
 *
 * <p>Covers chunked writes, symbol normalization, and where incremental collection resumes.
 */
@ExtendWith(MockitoExtension.class)
class PriceDataServiceTest {

    private static final LocalDateTime FIRST_OPEN = LocalDateTime.of(2024, 1, 1, 0, 0);

    @Mock
    private PriceDataJpaRepository priceDataJpaRepository;

    private final PriceDataMapper priceDataMapper = Mappers.getMapper(PriceDataMapper.class);
    private StoreConfig storeConfig;
    private PriceDataService priceDataService;

    @BeforeEach
    void setUp() {
        storeConfig = new StoreConfig();
        storeConfig.getPriceData().setBatchSize(2);
        priceDataService = new PriceDataService(
                priceDataJpaRepository, priceDataMapper, storeConfig, new RecordMetrics(new SimpleMeterRegistry()));
    }

    @Test
    @DisplayName("normalizeSymbol: strips the pair separator")
    void normalizeSymbol() {
        assertThat(PriceDataService.normalizeSymbol("BTC/USDT")).isEqualTo("BTCUSDT");
        assertThat(PriceDataService.normalizeSymbol("ETHUSDT")).isEqualTo("ETHUSDT");
        assertThat(PriceDataService.normalizeSymbol(null)).isNull();
    }

    @Test
    @DisplayName("saveBars: writes in batch-size chunks and stamps series symbol and interval")
    @SuppressWarnings("unchecked")
    void saveBarsChunksWrites() {
        List<PriceDatum> bars = hourlyBars(5);

        int saved = priceDataService.saveBars("BTC/USDT", "1h", bars);

        assertThat(saved).isEqualTo(5);
        ArgumentCaptor<List<PriceDataEntity>> captor = ArgumentCaptor.forClass(List.class);
        verify(priceDataJpaRepository, times(3)).saveAll(captor.capture());
        verify(priceDataJpaRepository, times(3)).flush();
        assertThat(captor.getAllValues()).extracting(List::size).containsExactly(2, 2, 1);
        assertThat(captor.getAllValues().stream().flatMap(List::stream))
                .allSatisfy(entity -> {
                    assertThat(entity.getId()).isNull();
                    assertThat(entity.getSymbol()).isEqualTo("BTCUSDT");
                    assertThat(entity.getInterval()).isEqualTo("1h");
                });
    }

    @Test
    @DisplayName("saveBars: a null bar rejects the series without writing")
    void saveBarsRejectsNullBar() {
        List<PriceDatum> bars = new ArrayList<>(hourlyBars(1));
        bars.add(null);

        assertThatThrownBy(() -> priceDataService.saveBars("X", "1m", bars))
                .isInstanceOf(BusinessException.class)
                .satisfies(ex -> {
                    BusinessException be = (BusinessException) ex;
                    assertThat(be.getErrorCode()).isEqualTo(ErrorCode.VALIDATION_ERROR);
                    assertThat(be.getDetails()).containsEntry("index", 1);
                });
        verifyNoInteractions(priceDataJpaRepository);
    }

    @Test
    @DisplayName("saveBars: an empty series writes nothing")
    void saveBarsEmpty() {
        assertThat(priceDataService.saveBars("BTCUSDT", "1h", List.of())).isZero();
        assertThat(priceDataService.saveBars("BTCUSDT", "1h", null)).isZero();
        verifyNoInteractions(priceDataJpaRepository);
    }

    @Test
    @DisplayName("nextFetchStart: one interval after the newest stored bar")
    void nextFetchStartAfterLatestBar() {
        when(priceDataJpaRepository.findFirstBySymbolAndIntervalOrderByOpenTimeDesc("BTCUSDT", "4h"))
                .thenReturn(Optional.of(PriceDataEntity.builder().openTime(FIRST_OPEN).build()));

        assertThat(priceDataService.nextFetchStart("BTC/USDT", "4h")).isEqualTo(FIRST_OPEN.plusHours(4));
    }

    @Test
    @DisplayName("nextFetchStart: monthly bars advance by calendar month")
    void nextFetchStartMonthly() {
        LocalDateTime january = LocalDateTime.of(2024, 1, 31, 0, 0);
        when(priceDataJpaRepository.findFirstBySymbolAndIntervalOrderByOpenTimeDesc("BTCUSDT", "1M"))
                .thenReturn(Optional.of(PriceDataEntity.builder().openTime(january).build()));

        assertThat(priceDataService.nextFetchStart("BTCUSDT", "1M")).isEqualTo(LocalDateTime.of(2024, 2, 29, 0, 0));
    }

    @Test
    @DisplayName("nextFetchStart: empty series starts at the configured history start")
    void nextFetchStartEmptySeries() {
        when(priceDataJpaRepository.findFirstBySymbolAndIntervalOrderByOpenTimeDesc("BTCUSDT", "1d"))
                .thenReturn(Optional.empty());

        assertThat(priceDataService.nextFetchStart("BTCUSDT", "1d")).isEqualTo(LocalDateTime.of(2017, 8, 17, 0, 0));
    }

    @Test
    @DisplayName("nextFetchStart: rejects an unknown interval label")
    void nextFetchStartUnknownInterval() {
        assertThatThrownBy(() -> priceDataService.nextFetchStart("BTCUSDT", "7x"))
                .isInstanceOf(BusinessException.class)
                .satisfies(ex ->
                        assertThat(((BusinessException) ex).getErrorCode()).isEqualTo(ErrorCode.VALIDATION_ERROR));
        verifyNoInteractions(priceDataJpaRepository);
    }

    @Test
    @DisplayName("findBars: queries with the normalized symbol")
    void findBarsNormalizesSymbol() {
        LocalDateTime to = FIRST_OPEN.plusDays(1);
        when(priceDataJpaRepository.findBySymbolAndIntervalAndOpenTimeBetweenOrderByOpenTimeAscIdAsc(
                        "BTCUSDT", "1h", FIRST_OPEN, to))
                .thenReturn(List.of(PriceDataEntity.builder()
                        .id(1L)
                        .symbol("BTCUSDT")
                        .interval("1h")
                        .openTime(FIRST_OPEN)
                        .close(42000.0)
                        .build()));

        List<PriceDatum> bars = priceDataService.findBars("BTC/USDT", "1h", FIRST_OPEN, to);

        assertThat(bars).hasSize(1);
        assertThat(bars.get(0).getClose()).isEqualTo(42000.0);
    }

    private List<PriceDatum> hourlyBars(int count) {
        List<PriceDatum> bars = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            LocalDateTime open = FIRST_OPEN.plusHours(i);
            bars.add(PriceDatum.builder()
                    .id(100L + i)
                    .symbol("ignored")
                    .interval("ignored")
                    .openTime(open)
                    .open(100.0 + i)
                    .high(101.0 + i)
                    .low(99.0 + i)
                    .close(100.5 + i)
                    .volume(10.0)
                    .closeTime(open.plusMinutes(59).plusSeconds(59))
                    .count(7)
                    .build());
        }
        return bars;
    }
}
