package org.pricewatch.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.List;

// Resolves the days parameter to a supported range, falling back to DEFAULT_DAYS. Never fails.
public class RangeValidator {
    private static final Logger LOG = LoggerFactory.getLogger(RangeValidator.class);

    public static final List<Integer> ALLOWED_DAYS = List.of(7, 30, 90);
    public static final int DEFAULT_DAYS = 90;

    public int resolveDays(String raw) {
        String s = (raw == null) ? "" : raw.trim();
        if (s.isEmpty()) return DEFAULT_DAYS;

        BigDecimal value;
        try {
            value = new BigDecimal(s);
        } catch (NumberFormatException e) {
            LOG.debug("days={} is not a number, using {}", s, DEFAULT_DAYS);
            return DEFAULT_DAYS;
        }

        if (value.signum() <= 0) return DEFAULT_DAYS;

        // No snapping to the nearest range: 14 means the default, not 7 or 30
        for (int allowed : ALLOWED_DAYS) {
            if (value.compareTo(BigDecimal.valueOf(allowed)) == 0) return allowed;
        }

        LOG.debug("days={} is not one of {}, using {}", s, ALLOWED_DAYS, DEFAULT_DAYS);
        return DEFAULT_DAYS;
    }

    public static boolean isAllowed(int days) {
        return ALLOWED_DAYS.contains(days);
    }
}
