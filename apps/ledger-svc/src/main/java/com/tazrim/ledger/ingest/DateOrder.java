package com.tazrim.ledger.ingest;

import java.time.format.DateTimeFormatter;
import java.time.format.ResolverStyle;
import java.util.List;

public enum DateOrder {
    DAY_FIRST("d/M/uuuu", "d/M/uu"),
    MONTH_FIRST("M/d/uuuu", "M/d/uu");

    private final List<DateTimeFormatter> formats;

    DateOrder(String fourDigitYear, String twoDigitYear) {
        this.formats = List.of(
                DateTimeFormatter.ofPattern(fourDigitYear).withResolverStyle(ResolverStyle.STRICT),
                DateTimeFormatter.ofPattern(twoDigitYear).withResolverStyle(ResolverStyle.STRICT),
                DateTimeFormatter.ofPattern("uuuu-MM-dd").withResolverStyle(ResolverStyle.STRICT)
        );
    }

    /**
     * Formats to try, in order: 4-digit year, 2-digit year, then ISO dates which are never ambiguous.
     */
    public List<DateTimeFormatter> formats() {
        return formats;
    }
}
