package com.tradestore.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the positions table.
 * A row is open while closed_at is null. Long and short legs are separate columns.
 */
@Entity
@Table(name = "positions")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PositionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "position_id")
    private Long positionId;

    @Column(name = "account_id", nullable = false)
    private Long accountId;

    @Column(nullable = false)
    private String symbol;

    @Column(name = "long_qty")
    private Double longQty;

    @Column(name = "short_qty")
    private Double shortQty;

    @Column(name = "long_cost_basis")
    private Double longCostBasis;

    @Column(name = "short_cost_basis")
    private Double shortCostBasis;

    @Column(name = "short_margin_used")
    private Double shortMarginUsed;

    @Column(name = "opened_at", nullable = false, updatable = false)
    private LocalDateTime openedAt;

    @Column(name = "closed_at")
    private LocalDateTime closedAt;

    @PrePersist
    void applyDefaults() {
        if (longQty == null) {
            longQty = 0.0;
        }
        if (shortQty == null) {
            shortQty = 0.0;
        }
        if (longCostBasis == null) {
            longCostBasis = 0.0;
        }
        if (shortCostBasis == null) {
            shortCostBasis = 0.0;
        }
        if (shortMarginUsed == null) {
            shortMarginUsed = 0.0;
        }
    }
}
