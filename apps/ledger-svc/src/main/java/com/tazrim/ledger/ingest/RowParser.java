package com.tazrim.ledger.ingest;

import com.tazrim.ledger.counterparty.CounterpartyKeys;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns raw statement rows into {@link RowOutcome}s for one statement. Date formats are fixed per
 * column before the first row is parsed.
 */
public class RowParser {

    public static final String EMPTY_ROW = "empty row";
    public static final String EMPTY_AMOUNT = "empty amount";

    private final ColumnMapping mapping;
    private final List<DateTimeFormatter> primaryFormats;
    private final List<DateTimeFormatter> secondaryFormats;
    private final MoneyParser moneyParser;
    private final String unknownCounterparty;

    public RowParser(
            ColumnMapping mapping,
            DateOrder primaryOrder,
            DateOrder secondaryOrder,
            MoneyParser moneyParser,
            String unknownCounterparty
    ) {
        this.mapping = mapping;
        this.primaryFormats = primaryOrder.formats();
        this.secondaryFormats = secondaryOrder.formats();
        this.moneyParser = moneyParser;
        this.unknownCounterparty = unknownCounterparty;
    }

    public RowOutcome parse(StatementReader.RawRow row) {
        try {
            return mapping.feedKind() == FeedKind.CARD ? parseCard(row) : parseBank(row);
        } catch (StatementRejectedException ex) {
            return new RowOutcome.Fatal(ex);
        }
    }

    private RowOutcome parseCard(StatementReader.RawRow row) {
        String rawDate = cell(row, CanonicalField.DATE);
        String rawPostingDate = cell(row, CanonicalField.SECONDARY_DATE);
        String merchant = cell(row, CanonicalField.COUNTERPARTY);
        String rawAmount = cell(row, CanonicalField.AMOUNT);

        if (allBlank(rawDate, rawPostingDate, merchant, rawAmount)) {
            return skipped(row, EMPTY_ROW);
        }

        LocalDate postingDate = parseDate(row, rawPostingDate, secondaryFormats).orElse(null);
        LocalDate date = parseDate(row, rawDate, primaryFormats).orElse(postingDate);
        if (date == null) {
            throw new DateParseException(row.rowIndex(), "Missing transaction date");
        }
        if (postingDate == null) {
            postingDate = date;
        }
        if (merchant.isEmpty()) {
            merchant = unknownCounterparty;
        }
        if (rawAmount.isEmpty()) {
            return skipped(row, EMPTY_AMOUNT);
        }

        limited(row, CanonicalField.COUNTERPARTY, merchant, FieldLimits.COUNTERPARTY);
        MoneyParser.Money amount = money(row, rawAmount, CanonicalField.AMOUNT);
        MoneyParser.Money charged = optionalMoney(row, CanonicalField.CHARGED_AMOUNT);
        String hint = limited(row, CanonicalField.CATEGORY_HINT, blankToNull(cell(row, CanonicalField.CATEGORY_HINT)), FieldLimits.CATEGORY);

        return new RowOutcome.Accepted(new ParsedActivity(
                row.rowIndex(),
                date,
                postingDate,
                merchant,
                null,
                null,
                null,
                amount.amount(),
                charged == null ? null : charged.amount(),
                charged == null ? null : charged.currency(),
                null,
                amount.currency(),
                hint,
                merchant,
                CounterpartyKeys.canonicalize(merchant)
        ));
    }

    private RowOutcome parseBank(StatementReader.RawRow row) {
        String rawDate = cell(row, CanonicalField.DATE);
        String rawValueDate = cell(row, CanonicalField.SECONDARY_DATE);
        String description = cell(row, CanonicalField.DESCRIPTION);
        String rawDebit = cell(row, CanonicalField.DEBIT);
        String rawCredit = cell(row, CanonicalField.CREDIT);

        if (allBlank(rawDate, rawValueDate, description, rawDebit, rawCredit)) {
            return skipped(row, EMPTY_ROW);
        }

        LocalDate valueDate = parseDate(row, rawValueDate, secondaryFormats).orElse(null);
        LocalDate date = parseDate(row, rawDate, primaryFormats).orElse(valueDate);
        if (date == null) {
            throw new DateParseException(row.rowIndex(), "Missing activity date");
        }
        if (rawDebit.isEmpty() && rawCredit.isEmpty()) {
            return skipped(row, EMPTY_AMOUNT);
        }

        MoneyParser.Money debit = optionalMoney(row, CanonicalField.DEBIT);
        MoneyParser.Money credit = optionalMoney(row, CanonicalField.CREDIT);
        MoneyParser.Money balance = optionalMoney(row, CanonicalField.BALANCE);
        if (description.isEmpty()) {
            description = unknownCounterparty;
        }
        limited(row, CanonicalField.DESCRIPTION, description, FieldLimits.DESCRIPTION);
        String payee = cell(row, CanonicalField.COUNTERPARTY);
        String counterparty = payee.isEmpty() ? description : payee;
        limited(row, payee.isEmpty() ? CanonicalField.DESCRIPTION : CanonicalField.COUNTERPARTY, counterparty, FieldLimits.COUNTERPARTY);
        String reference = limited(row, CanonicalField.REFERENCE, blankToNull(cell(row, CanonicalField.REFERENCE)), FieldLimits.REFERENCE);
        String hint = limited(row, CanonicalField.CATEGORY_HINT, blankToNull(cell(row, CanonicalField.CATEGORY_HINT)), FieldLimits.CATEGORY);
        String currency = debit != null ? debit.currency() : credit.currency();

        return new RowOutcome.Accepted(new ParsedActivity(
                row.rowIndex(),
                date,
                valueDate,
                description,
                reference,
                debit == null ? null : debit.amount(),
                credit == null ? null : credit.amount(),
                null,
                null,
                null,
                balance == null ? null : balance.amount(),
                currency,
                hint,
                counterparty,
                CounterpartyKeys.canonicalize(counterparty)
        ));
    }

    private Optional<LocalDate> parseDate(StatementReader.RawRow row, String raw, List<DateTimeFormatter> formats) {
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        Optional<LocalDate> parsed = DateOrderInference.tryParse(raw, formats);
        if (parsed.isEmpty()) {
            throw new DateParseException(row.rowIndex(), "Unsupported date format: " + raw);
        }
        return parsed;
    }

    private static String limited(StatementReader.RawRow row, CanonicalField field, String value, int maxLength) {
        if (value != null && value.length() > maxLength) {
            throw new FieldTooLongException(row.rowIndex(), field, maxLength);
        }
        return value;
    }

    private MoneyParser.Money money(StatementReader.RawRow row, String raw, CanonicalField field) {
        try {
            return moneyParser.parse(raw);
        } catch (InvalidAmountException ex) {
            throw ex.atRow(row.rowIndex(), field);
        }
    }

    private MoneyParser.Money optionalMoney(StatementReader.RawRow row, CanonicalField field) {
        String raw = cell(row, field);
        return raw.isEmpty() ? null : money(row, raw, field);
    }

    private String cell(StatementReader.RawRow row, CanonicalField field) {
        return mapping.cell(row, field);
    }

    private RowOutcome skipped(StatementReader.RawRow row, String reason) {
        Map<String, String> snapshot = new LinkedHashMap<>();
        for (CanonicalField field : CanonicalField.values()) {
            if (mapping.has(field)) {
                snapshot.put(field.label(), cell(row, field));
            }
        }
        return new RowOutcome.Skipped(new SkipRecord(row.rowIndex(), reason, snapshot));
    }

    private static boolean allBlank(String... values) {
        for (String value : values) {
            if (!value.isEmpty()) {
                return false;
            }
        }
        return true;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
