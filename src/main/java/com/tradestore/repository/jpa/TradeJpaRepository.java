package com.tradestore.repository.jpa;

import com.tradestore.entity.TradeEntity;
import java.time.LocalDateTime;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the trades table.
 * Append-only fill history; all reads are per account, newest first.
 */
@Repository
public interface TradeJpaRepository extends JpaRepository<TradeEntity, Long> {

    List<TradeEntity> findByAccountIdOrderByTimestampDescTradeIdDesc(Long accountId);

    List<TradeEntity> findByAccountIdAndSymbolOrderByTimestampDescTradeIdDesc(Long accountId, String symbol);

    List<TradeEntity> findByAccountIdAndTimestampBetweenOrderByTimestampDescTradeIdDesc(
            Long accountId, LocalDateTime from, LocalDateTime to);

    List<TradeEntity> findByAccountIdAndSymbolAndTimestampBetweenOrderByTimestampDescTradeIdDesc(
            Long accountId, String symbol, LocalDateTime from, LocalDateTime to);
}
