package com.tazrim.ledger.ingest;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Decides once per column whether {@code NN/NN/YYYY} values are day-first or month-first.
 * A first component above 12 can only be a day; a second component above 12 can only be a day
 * in month-first order. Day-first evidence wins; without evidence the column is day-first.
 */
public final class DateOrderInference {

    private DateOrderInference() {
    }

    public static DateOrder infer(Collection<String> columnValues) {
        int dayFirstEvidence = 0;
        int monthFirstEvidence = 0;
        for (String value : columnValues) {
            if (value == null || value.isBlank()) {
                continue;
            }
            String[] parts = value.strip().split("/");
            if (parts.length < 3) {
                continue;
            }
            Integer first = toInt(parts[0]);
            Integer second = toInt(parts[1]);
            if (first == null || second == null) {
                continue;
            }
            if (first > 12) {
                dayFirstEvidence++;
            }
            if (second > 12) {
                monthFirstEvidence++;
            }
        }
        if (dayFirstEvidence > 0) {
            return DateOrder.DAY_FIRST;
        }
        if (monthFirstEvidence > 0) {
            return DateOrder.MONTH_FIRST;
        }
        return DateOrder.DAY_FIRST;
    }

    public static Optional<LocalDate> tryParse(String value, List<DateTimeFormatter> formats) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String trimmed = value.strip();
        for (DateTimeFormatter format : formats) {
            Optional<LocalDate> parsed = parseWith(trimmed, format);
            if (parsed.isPresent()) {
                return parsed;
            }
        }
        return Optional.empty();
    }

    private static Optional<LocalDate> parseWith(String value, DateTimeFormatter format) {
        try {
            return Optional.of(LocalDate.parse(value, format));
        } catch (DateTimeParseException ex) {
            return Optional.empty();
        }
    }

    private static Integer toInt(String part) {
        String trimmed = part.strip();
        if (trimmed.isEmpty() || !trimmed.chars().allMatch(Character::isDigit)) {
            return null;
        }
        try {
            return Integer.parseInt(trimmed);
        } catch (NumberFormatException ex) {
            return null;
        }
    }
}
