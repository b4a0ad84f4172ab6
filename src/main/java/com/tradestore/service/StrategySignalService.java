package com.tradestore.service;

import com.tradestore.domain.model.StrategySignal;
import com.tradestore.entity.StrategySignalEntity;
import com.tradestore.mapper.StrategySignalMapper;
import com.tradestore.observability.RecordMetrics;
import com.tradestore.repository.jpa.StrategySignalJpaRepository;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Append-only log of strategy outputs, one row per evaluation tick.
 * Signals are market-level data and are not tied to an account.
 */
@Service
public class StrategySignalService {

    private static final Logger log = LoggerFactory.getLogger(StrategySignalService.class);

    private static final String TABLE = "strategy_signals";

    private final StrategySignalJpaRepository strategySignalJpaRepository;
    private final StrategySignalMapper strategySignalMapper;
    private final RecordMetrics recordMetrics;

    public StrategySignalService(
            StrategySignalJpaRepository strategySignalJpaRepository,
            StrategySignalMapper strategySignalMapper,
            RecordMetrics recordMetrics) {
        this.strategySignalJpaRepository = strategySignalJpaRepository;
        this.strategySignalMapper = strategySignalMapper;
        this.recordMetrics = recordMetrics;
    }

    @Transactional
    public StrategySignal recordSignal(StrategySignal signal) {
        StrategySignalEntity entity = strategySignalMapper.toEntity(signal);
        entity.setSignalId(null);
        StrategySignalEntity saved = strategySignalJpaRepository.save(entity);
        recordMetrics.recordInserted(TABLE, 1);
        log.info(
                "Signal recorded: signalId={}, strategy={}, symbol={}, interval={}, signal={}",
                saved.getSignalId(),
                saved.getStrategyName(),
                saved.getSymbol(),
                saved.getInterval(),
                saved.getSignal());
        return strategySignalMapper.toDomain(saved);
    }

    /**
     * Signals of a strategy, newest first, optionally narrowed to a symbol and then an interval.
     * An interval without a symbol is ignored.
     */
    @Transactional(readOnly = true)
    public List<StrategySignal> listSignals(String strategyName, String symbol, String interval) {
        List<StrategySignalEntity> entities;
        if (symbol == null) {
            entities = strategySignalJpaRepository.findByStrategyNameOrderByTimestampDescSignalIdDesc(strategyName);
        } else if (interval == null) {
            entities = strategySignalJpaRepository.findByStrategyNameAndSymbolOrderByTimestampDescSignalIdDesc(
                    strategyName, symbol);
        } else {
            entities =
                    strategySignalJpaRepository.findByStrategyNameAndSymbolAndIntervalOrderByTimestampDescSignalIdDesc(
                            strategyName, symbol, interval);
        }
        return strategySignalMapper.toDomainList(entities);
    }

    @Transactional(readOnly = true)
    public Optional<StrategySignal> latestSignal(String strategyName, String symbol, String interval) {
        return strategySignalJpaRepository
                .findFirstByStrategyNameAndSymbolAndIntervalOrderByTimestampDescSignalIdDesc(
                        strategyName, symbol, interval)
                .map(strategySignalMapper::toDomain);
    }
}
