package com.tradestore.service;

import com.tradestore.config.StoreConfig;
import com.tradestore.domain.enums.KlineInterval;
import com.tradestore.domain.model.PriceDatum;
import com.tradestore.entity.PriceDataEntity;
import com.tradestore.exception.BusinessException;
import com.tradestore.exception.ErrorCode;
import com.tradestore.mapper.PriceDataMapper;
import com.tradestore.observability.RecordMetrics;
import com.tradestore.repository.jpa.PriceDataJpaRepository;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Stores and reads OHLCV bar series.
 *
 * <p>Bars are written per (symbol, interval) series in chunks of
 * {@code tradestore.price-data.batch-size}. Duplicate bars are accepted as-is: the table has no
 * natural-key constraint, so a re-fetched window is stored twice.
 *
 * <p>{@link #nextFetchStart} tells an external collector where to resume: one interval after
 * the newest stored bar, or the configured history start for an empty series.
 */
@Service
public class PriceDataService {

    private static final Logger log = LoggerFactory.getLogger(PriceDataService.class);

    private static final String TABLE = "price_data";

    private final PriceDataJpaRepository priceDataJpaRepository;
    private final PriceDataMapper priceDataMapper;
    private final StoreConfig storeConfig;
    private final RecordMetrics recordMetrics;

    public PriceDataService(
            PriceDataJpaRepository priceDataJpaRepository,
            PriceDataMapper priceDataMapper,
            StoreConfig storeConfig,
            RecordMetrics recordMetrics) {
        this.priceDataJpaRepository = priceDataJpaRepository;
        this.priceDataMapper = priceDataMapper;
        this.storeConfig = storeConfig;
        this.recordMetrics = recordMetrics;
    }

    /** Exchange pair notation "BTC/USDT" is stored as "BTCUSDT". */
    public static String normalizeSymbol(String symbol) {
        return symbol == null ? null : symbol.replace("/", "");
    }

    /**
     * Appends bars for one symbol/interval series in a single transaction.
     * The symbol and interval on each bar are overwritten with the series values.
     * A null bar rejects the whole series before anything is written.
     *
     * @return the number of bars written
     */
    @Transactional
    public int saveBars(String symbol, String interval, List<PriceDatum> bars) {
        if (bars == null || bars.isEmpty()) {
            return 0;
        }
        for (int i = 0; i < bars.size(); i++) {
            if (bars.get(i) == null) {
                throw new BusinessException(
                        ErrorCode.VALIDATION_ERROR, "Price bar series contains a null bar", Map.of("index", i));
            }
        }
        String normalized = normalizeSymbol(symbol);
        int batchSize = Math.max(1, storeConfig.getPriceData().getBatchSize());

        for (int from = 0; from < bars.size(); from += batchSize) {
            List<PriceDatum> chunk = bars.subList(from, Math.min(from + batchSize, bars.size()));
            List<PriceDataEntity> entities = priceDataMapper.toEntityList(chunk);
            for (PriceDataEntity entity : entities) {
                entity.setId(null);
                entity.setSymbol(normalized);
                entity.setInterval(interval);
            }
            priceDataJpaRepository.saveAll(entities);
            priceDataJpaRepository.flush();
        }

        recordMetrics.recordInserted(TABLE, bars.size());
        log.info("Price bars saved: symbol={}, interval={}, count={}", normalized, interval, bars.size());
        return bars.size();
    }

    /** Bars with openTime in [from, to], oldest first. */
    @Transactional(readOnly = true)
    public List<PriceDatum> findBars(String symbol, String interval, LocalDateTime from, LocalDateTime to) {
        return priceDataMapper.toDomainList(
                priceDataJpaRepository.findBySymbolAndIntervalAndOpenTimeBetweenOrderByOpenTimeAscIdAsc(
                        normalizeSymbol(symbol), interval, from, to));
    }

    @Transactional(readOnly = true)
    public Optional<LocalDateTime> latestOpenTime(String symbol, String interval) {
        return priceDataJpaRepository
                .findFirstBySymbolAndIntervalOrderByOpenTimeDesc(normalizeSymbol(symbol), interval)
                .map(PriceDataEntity::getOpenTime);
    }

    /**
     * Open time of the first bar an incremental collector still needs.
     *
     * @throws BusinessException if the interval label is not a known kline interval
     */
    @Transactional(readOnly = true)
    public LocalDateTime nextFetchStart(String symbol, String interval) {
        KlineInterval klineInterval = KlineInterval.fromLabel(interval)
                .orElseThrow(() ->
                        new BusinessException(ErrorCode.VALIDATION_ERROR, "Unknown kline interval: " + interval));
        return latestOpenTime(symbol, interval)
                .map(klineInterval::next)
                .orElse(storeConfig.getPriceData().getHistoryStart());
    }
}
