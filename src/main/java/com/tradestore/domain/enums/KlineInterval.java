package com.tradestore.domain.enums;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Optional;

/**
 * Kline interval labels as used by the exchange ("1m", "4h", "1M", ...).
 *
 * <p>The {@code interval} column stays free text; this enum is only consulted when a bar
 * duration is needed, e.g. to compute where incremental collection resumes.
 */
public enum KlineInterval {
    ONE_MINUTE("1m", Duration.ofMinutes(1)),
    THREE_MINUTES("3m", Duration.ofMinutes(3)),
    FIVE_MINUTES("5m", Duration.ofMinutes(5)),
    FIFTEEN_MINUTES("15m", Duration.ofMinutes(15)),
    THIRTY_MINUTES("30m", Duration.ofMinutes(30)),
    ONE_HOUR("1h", Duration.ofHours(1)),
    TWO_HOURS("2h", Duration.ofHours(2)),
    FOUR_HOURS("4h", Duration.ofHours(4)),
    SIX_HOURS("6h", Duration.ofHours(6)),
    EIGHT_HOURS("8h", Duration.ofHours(8)),
    TWELVE_HOURS("12h", Duration.ofHours(12)),
    ONE_DAY("1d", Duration.ofDays(1)),
    THREE_DAYS("3d", Duration.ofDays(3)),
    ONE_WEEK("1w", Duration.ofDays(7)),
    ONE_MONTH("1M", null);

    private final String label;
    private final Duration duration;

    KlineInterval(String label, Duration duration) {
        this.label = label;
        this.duration = duration;
    }

    public String getLabel() {
        return label;
    }

    /** Labels are case-sensitive: "1m" is a minute, "1M" a month. */
    public static Optional<KlineInterval> fromLabel(String label) {
        return Arrays.stream(values()).filter(i -> i.label.equals(label)).findFirst();
    }

    /** Open time of the bar that follows one opening at {@code openTime}. */
    public LocalDateTime next(LocalDateTime openTime) {
        // months vary in length
        return duration == null ? openTime.plusMonths(1) : openTime.plus(duration);
    }
}
