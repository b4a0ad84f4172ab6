package com.tradestore.repository.jpa;

import com.tradestore.entity.PriceDataEntity;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the price_data table.
 * Bars are read by (symbol, interval) over an open_time window. The newest stored bar tells
 * an incremental collector where to resume.
 */
@Repository
public interface PriceDataJpaRepository extends JpaRepository<PriceDataEntity, Long> {

    List<PriceDataEntity> findBySymbolAndIntervalAndOpenTimeBetweenOrderByOpenTimeAscIdAsc(
            String symbol, String interval, LocalDateTime from, LocalDateTime to);

    Optional<PriceDataEntity> findFirstBySymbolAndIntervalOrderByOpenTimeDesc(String symbol, String interval);
}
