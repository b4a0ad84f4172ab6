package com.tradestore.repository.jpa;

import com.tradestore.entity.PositionEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the positions table.
 * Open positions are rows with closed_at IS NULL. Nothing prevents several open rows
 * for the same account and symbol.
 */
@Repository
public interface PositionJpaRepository extends JpaRepository<PositionEntity, Long> {

    List<PositionEntity> findByAccountIdAndClosedAtIsNullOrderByOpenedAtAsc(Long accountId);

    List<PositionEntity> findByAccountIdAndSymbolOrderByOpenedAtAsc(Long accountId, String symbol);

    List<PositionEntity> findByAccountIdAndSymbolAndClosedAtIsNull(Long accountId, String symbol);
}
