package com.tradestore.service;

import com.tradestore.domain.model.Account;
import com.tradestore.domain.model.Trade;
import com.tradestore.entity.TradeEntity;
import com.tradestore.exception.ResourceNotFoundException;
import com.tradestore.mapper.TradeMapper;
import com.tradestore.observability.RecordMetrics;
import com.tradestore.repository.jpa.TradeJpaRepository;
import java.time.LocalDateTime;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Append-only trade journal.
 *
 * <p>{@link #recordTrade} only inserts the fill. {@link #recordTradeAndSettle} also moves the
 * account's cash by the trade's settlement amount inside the same transaction, so the trade row
 * and the balance change commit or roll back together.
 */
@Service
public class TradeService {

    private static final Logger log = LoggerFactory.getLogger(TradeService.class);

    private static final String TABLE = "trades";

    private final TradeJpaRepository tradeJpaRepository;
    private final TradeMapper tradeMapper;
    private final AccountService accountService;
    private final RecordMetrics recordMetrics;

    public TradeService(
            TradeJpaRepository tradeJpaRepository,
            TradeMapper tradeMapper,
            AccountService accountService,
            RecordMetrics recordMetrics) {
        this.tradeJpaRepository = tradeJpaRepository;
        this.tradeMapper = tradeMapper;
        this.accountService = accountService;
        this.recordMetrics = recordMetrics;
    }

    /**
     * Appends a trade. The owning account must exist; fee and realized P&L default to 0.
     */
    @Transactional
    public Trade recordTrade(Trade trade) {
        accountService.requireExists(trade.getAccountId());

        TradeEntity entity = tradeMapper.toEntity(trade);
        entity.setTradeId(null);
        TradeEntity saved = tradeJpaRepository.save(entity);
        recordMetrics.recordInserted(TABLE, 1);

        log.info(
                "Trade recorded: tradeId={}, accountId={}, symbol={}, side={}, qty={}, price={}",
                saved.getTradeId(),
                saved.getAccountId(),
                saved.getSymbol(),
                saved.getSide(),
                saved.getQuantity(),
                saved.getPrice());
        return tradeMapper.toDomain(saved);
    }

    /**
     * Appends a trade and settles it against the account's cash balance atomically.
     */
    @Transactional
    public Trade recordTradeAndSettle(Trade trade) {
        Trade recorded = recordTrade(trade);
        Account account =
                accountService.adjustCash(recorded.getAccountId(), recorded.settlementAmount(), recorded.getTimestamp());
        log.info(
                "Trade settled: tradeId={}, accountId={}, amount={}, cash={}",
                recorded.getTradeId(),
                account.getAccountId(),
                recorded.settlementAmount(),
                account.getCashBalance());
        return recorded;
    }

    @Transactional(readOnly = true)
    public Trade getTrade(Long tradeId) {
        return tradeJpaRepository
                .findById(tradeId)
                .map(tradeMapper::toDomain)
                .orElseThrow(() -> new ResourceNotFoundException("Trade", tradeId));
    }

    /** All trades of an account, newest first. */
    @Transactional(readOnly = true)
    public List<Trade> listTrades(Long accountId) {
        return tradeMapper.toDomainList(tradeJpaRepository.findByAccountIdOrderByTimestampDescTradeIdDesc(accountId));
    }

    @Transactional(readOnly = true)
    public List<Trade> listTrades(Long accountId, String symbol) {
        return tradeMapper.toDomainList(
                tradeJpaRepository.findByAccountIdAndSymbolOrderByTimestampDescTradeIdDesc(accountId, symbol));
    }

    /** Trades of an account with timestamp in [from, to], newest first. */
    @Transactional(readOnly = true)
    public List<Trade> listTrades(Long accountId, LocalDateTime from, LocalDateTime to) {
        return tradeMapper.toDomainList(tradeJpaRepository
                .findByAccountIdAndTimestampBetweenOrderByTimestampDescTradeIdDesc(accountId, from, to));
    }

    /** Trades of an account for one symbol with timestamp in [from, to], newest first. */
    @Transactional(readOnly = true)
    public List<Trade> listTrades(Long accountId, String symbol, LocalDateTime from, LocalDateTime to) {
        return tradeMapper.toDomainList(tradeJpaRepository
                .findByAccountIdAndSymbolAndTimestampBetweenOrderByTimestampDescTradeIdDesc(accountId, symbol, from, to));
    }
}
