package com.tradestore.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Service;

/**
 * Micrometer counters for rows appended to the store.
 *
 * <p>One counter, {@code tradestore.records.inserted}, tagged with the table name. Counters are
 * registered lazily on first use and cached.
 */
@Service
public class RecordMetrics {

    public static final String RECORDS_INSERTED = "tradestore.records.inserted";

    private final MeterRegistry meterRegistry;
    private final Map<String, Counter> counters = new ConcurrentHashMap<>();

    public RecordMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public void recordInserted(String table, int rows) {
        if (rows <= 0) {
            return;
        }
        counters.computeIfAbsent(table, t -> Counter.builder(RECORDS_INSERTED)
                        .description("Rows appended to the trading store")
                        .tag("table", t)
                        .register(meterRegistry))
                .increment(rows);
    }
}
