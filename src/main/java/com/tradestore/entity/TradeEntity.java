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
import org.hibernate.annotations.Immutable;

/**
 * JPA entity for the trades table.
 * Append-only: Hibernate never issues UPDATEs for this entity.
 * account_id carries a foreign key to accounts enforced by the database.
 */
@Entity
@Immutable
@Table(name = "trades")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TradeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "trade_id")
    private Long tradeId;

    @Column(name = "account_id", nullable = false)
    private Long accountId;

    @Column(nullable = false)
    private String symbol;

    @Column(nullable = false)
    private LocalDateTime timestamp;

    @Column(nullable = false)
    private String side;

    @Column(nullable = false)
    private Double quantity;

    @Column(nullable = false)
    private Double price;

    private Double fee;

    @Column(name = "realized_pl")
    private Double realizedPl;

    @Column(name = "strategy_name")
    private String strategyName;

    @PrePersist
    void applyDefaults() {
        if (fee == null) {
            fee = 0.0;
        }
        if (realizedPl == null) {
            realizedPl = 0.0;
        }
    }
}
