package org.pricewatch.service;

import com.codahale.metrics.Meter;
import org.pricewatch.dto.PriceRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

// Maps header + data rows to PriceRows. Malformed numbers become 0, logged and counted on the meter.
public class ResultMapper {
    private static final Logger LOG = LoggerFactory.getLogger(ResultMapper.class);

    static final String DATE = "date";
    static final String PRICE_USD = "price_usd";
    static final String VOLUME_USD = "volume_usd";

    private final Meter malformedCells;

    public ResultMapper(Meter malformedCells) {
        this.malformedCells = malformedCells;
    }

    public List<PriceRow> map(List<List<String>> rows) {
        if (rows == null || rows.size() < 2) return List.of();

        List<String> headers = rows.get(0);
        List<PriceRow> out = new ArrayList<>(rows.size() - 1);

        for (int i = 1; i < rows.size(); i++) {
            Map<String, String> cells = byHeader(headers, rows.get(i));
            out.add(new PriceRow(
                    cells.getOrDefault(DATE, ""),
                    number(cells.get(PRICE_USD), PRICE_USD, i),
                    number(cells.get(VOLUME_USD), VOLUME_USD, i)));
        }
        return out;
    }

    private static Map<String, String> byHeader(List<String> headers, List<String> row) {
        Map<String, String> cells = new HashMap<>();
        if (headers == null || row == null) return cells;

        int n = Math.min(headers.size(), row.size());
        for (int c = 0; c < n; c++) {
            String key = headers.get(c);
            if (key == null || key.isEmpty()) continue;
            String v = row.get(c);
            cells.put(key, (v == null) ? "" : v);
        }
        return cells;
    }

    private double number(String raw, String column, int rowIndex) {
        String s = (raw == null) ? "" : raw.trim();
        if (s.isEmpty()) return 0;

        double d;
        try {
            d = Double.parseDouble(s);
        } catch (NumberFormatException e) {
            return malformed(s, column, rowIndex);
        }
        return Double.isFinite(d) ? d : malformed(s, column, rowIndex);
    }

    private double malformed(String s, String column, int rowIndex) {
        malformedCells.mark();
        LOG.warn("Malformed numeric cell column={} row={} value='{}', using 0", column, rowIndex, s);
        return 0;
    }
}
