package com.tradestore.service;

import com.tradestore.domain.model.PortfolioHistoryRecord;
import com.tradestore.entity.PortfolioHistoryEntity;
import com.tradestore.mapper.PortfolioHistoryMapper;
import com.tradestore.observability.RecordMetrics;
import com.tradestore.repository.jpa.PortfolioHistoryJpaRepository;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Append-only valuation snapshots per account, as produced by an external valuation job.
 */
@Service
public class PortfolioHistoryService {

    private static final Logger log = LoggerFactory.getLogger(PortfolioHistoryService.class);

    private static final String TABLE = "portfolio_history";

    private final PortfolioHistoryJpaRepository portfolioHistoryJpaRepository;
    private final PortfolioHistoryMapper portfolioHistoryMapper;
    private final AccountService accountService;
    private final RecordMetrics recordMetrics;

    public PortfolioHistoryService(
            PortfolioHistoryJpaRepository portfolioHistoryJpaRepository,
            PortfolioHistoryMapper portfolioHistoryMapper,
            AccountService accountService,
            RecordMetrics recordMetrics) {
        this.portfolioHistoryJpaRepository = portfolioHistoryJpaRepository;
        this.portfolioHistoryMapper = portfolioHistoryMapper;
        this.accountService = accountService;
        this.recordMetrics = recordMetrics;
    }

    @Transactional
    public PortfolioHistoryRecord recordSnapshot(PortfolioHistoryRecord record) {
        accountService.requireExists(record.getAccountId());

        PortfolioHistoryEntity entity = portfolioHistoryMapper.toEntity(record);
        entity.setRecordId(null);
        PortfolioHistoryEntity saved = portfolioHistoryJpaRepository.save(entity);
        recordMetrics.recordInserted(TABLE, 1);
        log.info(
                "Portfolio snapshot recorded: recordId={}, accountId={}, value={}",
                saved.getRecordId(),
                saved.getAccountId(),
                saved.getPortfolioValue());
        return portfolioHistoryMapper.toDomain(saved);
    }

    /**
     * Snapshots of an account in chronological order. Each bound is inclusive and may be
     * omitted independently.
     */
    @Transactional(readOnly = true)
    public List<PortfolioHistoryRecord> listSnapshots(Long accountId, LocalDateTime from, LocalDateTime to) {
        List<PortfolioHistoryEntity> entities;
        if (from != null && to != null) {
            entities = portfolioHistoryJpaRepository.findByAccountIdAndTimestampBetweenOrderByTimestampAscRecordIdAsc(
                    accountId, from, to);
        } else if (from != null) {
            entities = portfolioHistoryJpaRepository
                    .findByAccountIdAndTimestampGreaterThanEqualOrderByTimestampAscRecordIdAsc(accountId, from);
        } else if (to != null) {
            entities = portfolioHistoryJpaRepository
                    .findByAccountIdAndTimestampLessThanEqualOrderByTimestampAscRecordIdAsc(accountId, to);
        } else {
            entities = portfolioHistoryJpaRepository.findByAccountIdOrderByTimestampAscRecordIdAsc(accountId);
        }
        return portfolioHistoryMapper.toDomainList(entities);
    }

    @Transactional(readOnly = true)
    public Optional<PortfolioHistoryRecord> latestSnapshot(Long accountId) {
        return portfolioHistoryJpaRepository
                .findFirstByAccountIdOrderByTimestampDescRecordIdDesc(accountId)
                .map(portfolioHistoryMapper::toDomain);
    }
}
