package com.tazrim.ledger.ingest;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts an exact amount and a currency code from a statement cell such as
 * {@code "₪1,234.50"}, {@code "1,000 USD"} or {@code "-12.30"}.
 */
public class MoneyParser {

    private static final Map<String, String> CURRENCY_SYMBOLS = new LinkedHashMap<>();

    static {
        CURRENCY_SYMBOLS.put("₪", "ILS");
        CURRENCY_SYMBOLS.put("$", "USD");
        CURRENCY_SYMBOLS.put("£", "GBP");
        CURRENCY_SYMBOLS.put("€", "EUR");
    }

    private static final Pattern ISO_CODE = Pattern.compile("\\b([A-Z]{3})\\b");
    private static final Pattern SPACES = Pattern.compile("[\\s\\u00A0\\u202F']");
    private static final Pattern DECIMAL = Pattern.compile("[-+]?(\\d+(\\.\\d*)?|\\.\\d+)");

    private final String defaultCurrency;

    public MoneyParser(String defaultCurrency) {
        if (defaultCurrency == null || defaultCurrency.isBlank()) {
            throw new IllegalArgumentException("defaultCurrency must be provided");
        }
        this.defaultCurrency = defaultCurrency;
    }

    public Money parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidAmountException(raw, "Empty amount");
        }
        String text = raw.strip();
        String currency = null;
        for (Map.Entry<String, String> symbol : CURRENCY_SYMBOLS.entrySet()) {
            if (text.contains(symbol.getKey())) {
                currency = symbol.getValue();
                text = text.replace(symbol.getKey(), "");
                break;
            }
        }
        if (currency == null) {
            Matcher matcher = ISO_CODE.matcher(text);
            if (matcher.find()) {
                currency = matcher.group(1);
                text = ISO_CODE.matcher(text).replaceAll("");
            }
        }
        if (currency == null) {
            currency = defaultCurrency;
        }

        String number = normalizeSeparators(SPACES.matcher(text).replaceAll("").replace('\u2212', '-'));
        if (number.isEmpty()) {
            throw new InvalidAmountException(raw, "Amount missing after normalization: " + raw);
        }
        if (!DECIMAL.matcher(number).matches()) {
            throw new InvalidAmountException(raw, "Invalid amount: " + raw);
        }
        return new Money(new BigDecimal(number), currency);
    }

    public String defaultCurrency() {
        return defaultCurrency;
    }

    // "1.234,50" uses a decimal comma; everything else treats commas as grouping.
    private String normalizeSeparators(String value) {
        int lastComma = value.lastIndexOf(',');
        int lastDot = value.lastIndexOf('.');
        if (lastComma >= 0 && lastDot >= 0 && lastComma > lastDot) {
            return value.replace(".", "").replace(',', '.');
        }
        return value.replace(",", "");
    }

    public record Money(BigDecimal amount, String currency) {
    }
}
