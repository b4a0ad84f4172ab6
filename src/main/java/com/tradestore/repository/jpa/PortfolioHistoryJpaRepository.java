package com.tradestore.repository.jpa;

import com.tradestore.entity.PortfolioHistoryEntity;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the portfolio_history table.
 * Snapshots are read in chronological order for equity curves.
 */
@Repository
public interface PortfolioHistoryJpaRepository extends JpaRepository<PortfolioHistoryEntity, Long> {

    List<PortfolioHistoryEntity> findByAccountIdOrderByTimestampAscRecordIdAsc(Long accountId);

    List<PortfolioHistoryEntity> findByAccountIdAndTimestampBetweenOrderByTimestampAscRecordIdAsc(
            Long accountId, LocalDateTime from, LocalDateTime to);

    List<PortfolioHistoryEntity> findByAccountIdAndTimestampGreaterThanEqualOrderByTimestampAscRecordIdAsc(
            Long accountId, LocalDateTime from);

    List<PortfolioHistoryEntity> findByAccountIdAndTimestampLessThanEqualOrderByTimestampAscRecordIdAsc(
            Long accountId, LocalDateTime to);

    Optional<PortfolioHistoryEntity> findFirstByAccountIdOrderByTimestampDescRecordIdDesc(Long accountId);
}
