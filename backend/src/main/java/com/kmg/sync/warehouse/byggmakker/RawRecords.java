package com.kmg.sync.warehouse.byggmakker;

import org.slf4j.Logger;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Helpers shared by the Byggmakker units for reading raw rows and looking up target keys.
 */
final class RawRecords {
    private static final int[] EAN_LENGTHS = {12, 13, 14};

    private RawRecords() {
    }

    static String text(Map<String, Object> row, String column) {
        Object value = row.get(column);
        return value == null ? "" : value.toString().trim();
    }

    /**
     * Returns the EAN as a digit string, or empty when it is not 12, 13 or 14 digits long.
     */
    static Optional<String> validEan(Object raw, Logger log) {
        if (raw == null) {
            log.warn("Invalid EAN (missing)");
            return Optional.empty();
        }
        String ean = raw.toString().trim();
        if (ean.isEmpty() || !ean.chars().allMatch(Character::isDigit)) {
            log.warn("Invalid EAN (non-digits): {}", ean);
            return Optional.empty();
        }
        for (int length : EAN_LENGTHS) {
            if (ean.length() == length) {
                return Optional.of(ean);
            }
        }
        log.warn("Invalid EAN length: {}", ean);
        return Optional.empty();
    }

    static Optional<Long> productIdByEan(JdbcTemplate jdbc, String ean) {
        List<Long> ids = jdbc.queryForList("SELECT product_id FROM ean_codes WHERE ean_code = ?", Long.class, ean);
        return ids.isEmpty() ? Optional.empty() : Optional.ofNullable(ids.get(0));
    }
}
