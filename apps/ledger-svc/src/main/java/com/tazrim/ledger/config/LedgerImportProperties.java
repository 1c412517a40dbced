package com.tazrim.ledger.config;

import java.util.regex.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

@ConfigurationProperties(prefix = "tazrim")
public record LedgerImportProperties(
        String homeCurrency,
        String unknownCounterparty,
        Integer draftPageMaxSize
) {

    private static final Pattern ISO_CURRENCY = Pattern.compile("[A-Z]{3}");

    public static final String DEFAULT_HOME_CURRENCY = "ILS";
    public static final String DEFAULT_UNKNOWN_COUNTERPARTY = "UNKNOWN";
    public static final int DEFAULT_DRAFT_PAGE_MAX_SIZE = 500;

    @ConstructorBinding
    public LedgerImportProperties {
        if (homeCurrency == null || homeCurrency.isBlank()) {
            homeCurrency = DEFAULT_HOME_CURRENCY;
        }
        if (!ISO_CURRENCY.matcher(homeCurrency).matches()) {
            throw new IllegalArgumentException("homeCurrency must be a 3-letter ISO code");
        }
        if (unknownCounterparty == null || unknownCounterparty.isBlank()) {
            unknownCounterparty = DEFAULT_UNKNOWN_COUNTERPARTY;
        }
        if (draftPageMaxSize == null) {
            draftPageMaxSize = DEFAULT_DRAFT_PAGE_MAX_SIZE;
        }
        if (draftPageMaxSize < 1) {
            throw new IllegalArgumentException("draftPageMaxSize must be positive");
        }
    }

    public static LedgerImportProperties defaults() {
        return new LedgerImportProperties(null, null, null);
    }
}
