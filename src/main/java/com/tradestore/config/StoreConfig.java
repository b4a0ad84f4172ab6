package com.tradestore.config;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.format.annotation.DateTimeFormat;

/**
 * Configuration properties for the trading store.
 *
 * <p>Controls price-data batch writes, where incremental bar collection starts when a
 * symbol/interval has no stored history, whether the schema drift check runs at startup and
 * which paths bypass the response envelope.
 */
@Configuration
@ConfigurationProperties(prefix = "tradestore")
@Getter
@Setter
public class StoreConfig {

    private PriceData priceData = new PriceData();

    private Schema schema = new Schema();

    private Api api = new Api();

    @Getter
    @Setter
    public static class PriceData {

        /** Number of bars flushed per JDBC batch when saving a bar series. */
        private int batchSize = 500;

        /** First open time to fetch for a symbol/interval with no stored bars. */
        @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
        private LocalDateTime historyStart = LocalDateTime.of(2017, 8, 17, 0, 0);
    }

    @Getter
    @Setter
    public static class Schema {

        /** Whether to compare the live catalog against the expected columns on startup. */
        private boolean verifyOnStartup = true;
    }

    @Getter
    @Setter
    public static class Api {

        /** Path prefixes whose bodies are written as-is instead of inside the response envelope. */
        private List<String> unwrappedPaths = new ArrayList<>(List.of("/actuator", "/error"));
    }
}
