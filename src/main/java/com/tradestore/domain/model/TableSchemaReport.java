package com.tradestore.domain.model;

import java.util.List;
import lombok.Builder;
import lombok.Data;

/** Result of comparing one table in the live catalog against its expected column set. */
@Data
@Builder
public class TableSchemaReport {

    private String tableName;
    private boolean present;
    private List<String> missingColumns;

    public boolean isComplete() {
        return present && (missingColumns == null || missingColumns.isEmpty());
    }
}
