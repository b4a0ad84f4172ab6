package com.tradestore.repository.jpa;

import com.tradestore.entity.StrategySignalEntity;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** JPA repository for the strategy_signals table. */
@Repository
public interface StrategySignalJpaRepository extends JpaRepository<StrategySignalEntity, Long> {

    List<StrategySignalEntity> findByStrategyNameOrderByTimestampDescSignalIdDesc(String strategyName);

    List<StrategySignalEntity> findByStrategyNameAndSymbolOrderByTimestampDescSignalIdDesc(
            String strategyName, String symbol);

    List<StrategySignalEntity> findByStrategyNameAndSymbolAndIntervalOrderByTimestampDescSignalIdDesc(
            String strategyName, String symbol, String interval);

    Optional<StrategySignalEntity> findFirstByStrategyNameAndSymbolAndIntervalOrderByTimestampDescSignalIdDesc(
            String strategyName, String symbol, String interval);
}
