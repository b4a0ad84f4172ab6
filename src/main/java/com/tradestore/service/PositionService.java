package com.tradestore.service;

import com.tradestore.domain.model.Position;
import com.tradestore.entity.PositionEntity;
import com.tradestore.exception.BusinessException;
import com.tradestore.exception.ResourceNotFoundException;
import com.tradestore.mapper.PositionMapper;
import com.tradestore.observability.RecordMetrics;
import com.tradestore.repository.jpa.PositionJpaRepository;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Position lifecycle: open, apply fills, close.
 *
 * <p>Closing sets {@code closedAt}; the row is kept and {@code openedAt} never changes.
 * Several open positions for the same account and symbol are allowed, and are logged at
 * DEBUG when one is opened next to another.
 */
@Service
public class PositionService {

    private static final Logger log = LoggerFactory.getLogger(PositionService.class);

    private static final String TABLE = "positions";

    private final PositionJpaRepository positionJpaRepository;
    private final PositionMapper positionMapper;
    private final AccountService accountService;
    private final RecordMetrics recordMetrics;

    public PositionService(
            PositionJpaRepository positionJpaRepository,
            PositionMapper positionMapper,
            AccountService accountService,
            RecordMetrics recordMetrics) {
        this.positionJpaRepository = positionJpaRepository;
        this.positionMapper = positionMapper;
        this.accountService = accountService;
        this.recordMetrics = recordMetrics;
    }

    /**
     * Opens a position. Quantities and cost bases default to 0, openedAt to now.
     */
    @Transactional
    public Position openPosition(Position position) {
        accountService.requireExists(position.getAccountId());

        PositionEntity entity = positionMapper.toEntity(position);
        entity.setPositionId(null);
        entity.setClosedAt(null);
        if (entity.getOpenedAt() == null) {
            entity.setOpenedAt(LocalDateTime.now());
        }

        int alreadyOpen = positionJpaRepository
                .findByAccountIdAndSymbolAndClosedAtIsNull(entity.getAccountId(), entity.getSymbol())
                .size();
        if (alreadyOpen > 0) {
            log.debug(
                    "Opening another position alongside {} open for accountId={}, symbol={}",
                    alreadyOpen,
                    entity.getAccountId(),
                    entity.getSymbol());
        }

        PositionEntity saved = positionJpaRepository.save(entity);
        recordMetrics.recordInserted(TABLE, 1);
        log.info(
                "Position opened: positionId={}, accountId={}, symbol={}, openedAt={}",
                saved.getPositionId(),
                saved.getAccountId(),
                saved.getSymbol(),
                saved.getOpenedAt());
        return positionMapper.toDomain(saved);
    }

    /**
     * Overwrites the supplied quantity, cost-basis and margin fields of an open position.
     * Null fields are left unchanged.
     *
     * @throws BusinessException if the position is already closed
     */
    @Transactional
    public Position updatePosition(Long positionId, Position updates) {
        PositionEntity entity = findEntity(positionId);
        requireOpen(entity);

        if (updates.getLongQty() != null) {
            entity.setLongQty(updates.getLongQty());
        }
        if (updates.getShortQty() != null) {
            entity.setShortQty(updates.getShortQty());
        }
        if (updates.getLongCostBasis() != null) {
            entity.setLongCostBasis(updates.getLongCostBasis());
        }
        if (updates.getShortCostBasis() != null) {
            entity.setShortCostBasis(updates.getShortCostBasis());
        }
        if (updates.getShortMarginUsed() != null) {
            entity.setShortMarginUsed(updates.getShortMarginUsed());
        }

        PositionEntity saved = positionJpaRepository.save(entity);
        log.info(
                "Position updated: positionId={}, longQty={}, shortQty={}",
                saved.getPositionId(),
                saved.getLongQty(),
                saved.getShortQty());
        return positionMapper.toDomain(saved);
    }

    /**
     * Closes an open position at {@code closedAt}, or now when null.
     *
     * @throws BusinessException if the position is already closed
     */
    @Transactional
    public Position closePosition(Long positionId, LocalDateTime closedAt) {
        PositionEntity entity = findEntity(positionId);
        requireOpen(entity);

        entity.setClosedAt(closedAt != null ? closedAt : LocalDateTime.now());
        PositionEntity saved = positionJpaRepository.save(entity);
        log.info("Position closed: positionId={}, closedAt={}", saved.getPositionId(), saved.getClosedAt());
        return positionMapper.toDomain(saved);
    }

    @Transactional(readOnly = true)
    public Position getPosition(Long positionId) {
        return positionMapper.toDomain(findEntity(positionId));
    }

    @Transactional(readOnly = true)
    public List<Position> listOpenPositions(Long accountId) {
        return positionMapper.toDomainList(
                positionJpaRepository.findByAccountIdAndClosedAtIsNullOrderByOpenedAtAsc(accountId));
    }

    /** Open and closed positions of one symbol, oldest first. */
    @Transactional(readOnly = true)
    public List<Position> listPositions(Long accountId, String symbol) {
        return positionMapper.toDomainList(
                positionJpaRepository.findByAccountIdAndSymbolOrderByOpenedAtAsc(accountId, symbol));
    }

    private PositionEntity findEntity(Long positionId) {
        return positionJpaRepository
                .findById(positionId)
                .orElseThrow(() -> new ResourceNotFoundException("Position", positionId));
    }

    private void requireOpen(PositionEntity entity) {
        if (entity.getClosedAt() != null) {
            throw new BusinessException(
                    "Position is already closed: " + entity.getPositionId(),
                    Map.of("positionId", entity.getPositionId(), "closedAt", entity.getClosedAt()));
        }
    }
}
