package com.tradestore.service;

import com.tradestore.config.StoreConfig;
import com.tradestore.domain.model.TableSchemaReport;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Compares the live database catalog with the columns this application expects.
 *
 * <p>Read-only: it reports missing tables and columns but never alters the schema. Additive
 * changes belong in a new Flyway migration. Runs once after startup when
 * {@code tradestore.schema.verify-on-startup} is true, and on demand via the schema endpoint.
 */
@Service
public class SchemaInspectionService {

    private static final Logger log = LoggerFactory.getLogger(SchemaInspectionService.class);

    /** Expected column names per table, in declaration order. */
    public static final Map<String, List<String>> EXPECTED_COLUMNS = Collections.unmodifiableMap(expectedColumns());

    private static Map<String, List<String>> expectedColumns() {
        Map<String, List<String>> columns = new LinkedHashMap<>();
        columns.put(
                "accounts",
                List.of(
                        "account_id",
                        "owner",
                        "created_at",
                        "cash_balance",
                        "margin_requirement",
                        "margin_used",
                        "last_update"));
        columns.put(
                "trades",
                List.of(
                        "trade_id",
                        "account_id",
                        "symbol",
                        "timestamp",
                        "side",
                        "quantity",
                        "price",
                        "fee",
                        "realized_pl",
                        "strategy_name"));
        columns.put(
                "positions",
                List.of(
                        "position_id",
                        "account_id",
                        "symbol",
                        "long_qty",
                        "short_qty",
                        "long_cost_basis",
                        "short_cost_basis",
                        "short_margin_used",
                        "opened_at",
                        "closed_at"));
        columns.put(
                "price_data",
                List.of(
                        "id",
                        "symbol",
                        "interval",
                        "open_time",
                        "open",
                        "high",
                        "low",
                        "close",
                        "volume",
                        "close_time",
                        "quote_volume",
                        "count",
                        "taker_buy_volume",
                        "taker_buy_quote_volume"));
        columns.put(
                "strategy_signals",
                List.of(
                        "signal_id",
                        "symbol",
                        "interval",
                        "timestamp",
                        "strategy_name",
                        "signal",
                        "confidence",
                        "metrics"));
        columns.put(
                "portfolio_history",
                List.of(
                        "record_id",
                        "account_id",
                        "timestamp",
                        "portfolio_value",
                        "long_exposure",
                        "short_exposure",
                        "gross_exposure",
                        "net_exposure",
                        "long_short_ratio"));
        return columns;
    }

    private final DataSource dataSource;
    private final StoreConfig storeConfig;

    public SchemaInspectionService(DataSource dataSource, StoreConfig storeConfig) {
        this.dataSource = dataSource;
        this.storeConfig = storeConfig;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void verifyOnStartup() {
        if (!storeConfig.getSchema().isVerifyOnStartup()) {
            log.info("Schema verification disabled");
            return;
        }
        List<TableSchemaReport> reports = inspect();
        long incomplete = reports.stream().filter(r -> !r.isComplete()).count();
        if (incomplete == 0) {
            log.info("Schema verified: {} tables complete", reports.size());
        }
    }

    /**
     * Inspects every expected table. Incomplete tables are logged at WARN.
     *
     * @throws IllegalStateException if the catalog cannot be read
     */
    public List<TableSchemaReport> inspect() {
        try (Connection connection = dataSource.getConnection()) {
            DatabaseMetaData metaData = connection.getMetaData();
            String schema = connection.getSchema();
            List<TableSchemaReport> reports = new ArrayList<>();

            for (Map.Entry<String, List<String>> expected : EXPECTED_COLUMNS.entrySet()) {
                Set<String> actual = readColumns(metaData, connection.getCatalog(), schema, expected.getKey());
                TableSchemaReport report = compare(expected.getKey(), expected.getValue(), actual);
                if (!report.isPresent()) {
                    log.warn("Schema drift: table {} is missing", report.getTableName());
                } else if (!report.isComplete()) {
                    log.warn(
                            "Schema drift: table {} is missing columns {}",
                            report.getTableName(),
                            report.getMissingColumns());
                }
                reports.add(report);
            }
            return reports;
        } catch (SQLException e) {
            log.error("Failed to read database catalog", e);
            throw new IllegalStateException("Schema inspection failed", e);
        }
    }

    /** Pure comparison of expected against actual column names (case-insensitive). */
    public static TableSchemaReport compare(String table, List<String> expectedColumns, Set<String> actualColumns) {
        if (actualColumns.isEmpty()) {
            return TableSchemaReport.builder()
                    .tableName(table)
                    .present(false)
                    .missingColumns(expectedColumns)
                    .build();
        }
        List<String> missing = expectedColumns.stream()
                .filter(column -> !actualColumns.contains(column.toLowerCase(Locale.ROOT)))
                .toList();
        return TableSchemaReport.builder()
                .tableName(table)
                .present(true)
                .missingColumns(missing)
                .build();
    }

    private Set<String> readColumns(DatabaseMetaData metaData, String catalog, String schema, String table)
            throws SQLException {
        Set<String> columns = collectColumns(metaData, catalog, schema, table);
        if (columns.isEmpty()) {
            // engines that fold unquoted identifiers to upper case
            columns = collectColumns(
                    metaData,
                    catalog,
                    schema != null ? schema.toUpperCase(Locale.ROOT) : null,
                    table.toUpperCase(Locale.ROOT));
        }
        return columns;
    }

    private Set<String> collectColumns(DatabaseMetaData metaData, String catalog, String schema, String table)
            throws SQLException {
        Set<String> columns = new HashSet<>();
        try (ResultSet rs = metaData.getColumns(catalog, schema, table, null)) {
            while (rs.next()) {
                columns.add(rs.getString("COLUMN_NAME").toLowerCase(Locale.ROOT));
            }
        }
        return columns;
    }
}
