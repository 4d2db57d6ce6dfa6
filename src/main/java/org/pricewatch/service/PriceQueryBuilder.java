package org.pricewatch.service;

import java.util.regex.Pattern;

// Renders the daily aggregation query. days is interpolated, so it must be in RangeValidator.ALLOWED_DAYS
public class PriceQueryBuilder {
    private static final Pattern TABLE_NAME =
            Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");

    private final String tableName;

    public PriceQueryBuilder(String tableName) {
        if (tableName == null || !TABLE_NAME.matcher(tableName).matches()) {
            throw new IllegalArgumentException("invalid table name: " + tableName);
        }
        this.tableName = tableName;
    }

    public String build(int days) {
        if (!RangeValidator.isAllowed(days)) {
            throw new IllegalArgumentException("days must be one of " + RangeValidator.ALLOWED_DAYS + ": " + days);
        }

        // date is cast explicitly so string and timestamp partitions compare the same way
        return "SELECT\n"
                + "  CAST(date AS DATE) AS date,\n"
                + "  AVG(price_usd) AS price_usd,\n"
                + "  SUM(volume_usd) AS volume_usd\n"
                + "FROM " + tableName + "\n"
                + "WHERE CAST(date AS DATE) >= date_add('day', -" + days + ", current_date)\n"
                + "GROUP BY CAST(date AS DATE)\n"
                + "ORDER BY CAST(date AS DATE) ASC";
    }
}
