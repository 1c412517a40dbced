package com.tazrim.ledger.ingest;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Maps a statement header row onto canonical fields using per-feed synonym tables.
 * Labels cover several issuers and export revisions; earlier synonyms win when a file carries more than one.
 */
public final class FormatDetector {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final Map<FeedKind, Map<CanonicalField, List<String>>> SYNONYMS = new EnumMap<>(FeedKind.class);

    static {
        Map<CanonicalField, List<String>> card = new LinkedHashMap<>();
        card.put(CanonicalField.DATE, List.of("תאריך העסקה", "תאריך עסקה", "Transaction Date", "Purchase Date", "Date"));
        card.put(CanonicalField.SECONDARY_DATE, List.of("תאריך חיוב", "Posting Date", "Charge Date", "Billing Date"));
        card.put(CanonicalField.COUNTERPARTY, List.of("בית העסק", "שם בית העסק", "שם בית עסק", "Merchant", "Merchant Name", "Description"));
        card.put(CanonicalField.AMOUNT, List.of("סכום העסקה", "סכום עסקה", "Transaction Amount", "Amount"));
        card.put(CanonicalField.CHARGED_AMOUNT, List.of("סכום החיוב", "סכום חיוב", "Charged Amount", "Billing Amount"));
        card.put(CanonicalField.CATEGORY_HINT, List.of("קטגוריה", "ענף", "Category"));
        SYNONYMS.put(FeedKind.CARD, card);

        Map<CanonicalField, List<String>> bank = new LinkedHashMap<>();
        bank.put(CanonicalField.DATE, List.of("תאריך", "תאריך פעולה", "תאריך התנועה", "Date", "Activity Date", "Booking Date"));
        bank.put(CanonicalField.SECONDARY_DATE, List.of("תאריך ערך", "Value Date"));
        bank.put(CanonicalField.DESCRIPTION, List.of("תיאור", "סוג תנועה", "תיאור התנועה", "Description", "Details"));
        bank.put(CanonicalField.COUNTERPARTY, List.of("שם המוטב", "Payee", "Beneficiary"));
        bank.put(CanonicalField.REFERENCE, List.of("אסמכתא", "אסמכתה", "Reference"));
        bank.put(CanonicalField.DEBIT, List.of("חובה", "Debit"));
        bank.put(CanonicalField.CREDIT, List.of("זכות", "Credit"));
        bank.put(CanonicalField.BALANCE, List.of("יתרה בש\"ח", "יתרה", "Balance"));
        bank.put(CanonicalField.CATEGORY_HINT, List.of("סוגי קטגוריות", "קטגוריה", "Category"));
        SYNONYMS.put(FeedKind.BANK, bank);
    }

    private FormatDetector() {
    }

    /**
     * Picks the first feed kind whose required columns are all present.
     */
    public static ColumnMapping detect(List<String> headers) {
        StatementFormatException closest = null;
        int closestMissing = Integer.MAX_VALUE;
        for (FeedKind kind : FeedKind.values()) {
            try {
                return detect(headers, kind);
            } catch (StatementFormatException ex) {
                if (ex.getMissingFields().size() < closestMissing) {
                    closest = ex;
                    closestMissing = ex.getMissingFields().size();
                }
            }
        }
        throw closest;
    }

    public static ColumnMapping detect(List<String> headers, FeedKind kind) {
        Map<String, String> labelsByKey = new LinkedHashMap<>();
        for (String header : headers) {
            labelsByKey.putIfAbsent(lookupKey(header), header);
        }

        Map<CanonicalField, String> columns = new EnumMap<>(CanonicalField.class);
        for (Map.Entry<CanonicalField, List<String>> entry : SYNONYMS.get(kind).entrySet()) {
            for (String synonym : entry.getValue()) {
                String label = labelsByKey.get(lookupKey(synonym));
                if (label != null) {
                    columns.put(entry.getKey(), label);
                    break;
                }
            }
        }

        List<String> missing = new ArrayList<>();
        for (CanonicalField field : requiredFields(kind)) {
            if (!columns.containsKey(field)) {
                missing.add(field.label());
            }
        }
        if (kind == FeedKind.BANK
                && !columns.containsKey(CanonicalField.DEBIT)
                && !columns.containsKey(CanonicalField.CREDIT)) {
            missing.add(CanonicalField.DEBIT.label() + " or " + CanonicalField.CREDIT.label());
        }
        if (!missing.isEmpty()) {
            throw new StatementFormatException(missing);
        }
        return new ColumnMapping(kind, columns);
    }

    public static List<CanonicalField> requiredFields(FeedKind kind) {
        return switch (kind) {
            case CARD -> List.of(CanonicalField.DATE, CanonicalField.COUNTERPARTY, CanonicalField.AMOUNT);
            case BANK -> List.of(CanonicalField.DATE, CanonicalField.DESCRIPTION);
        };
    }

    static String normalizeHeader(String header) {
        if (header == null) {
            return "";
        }
        return WHITESPACE.matcher(header.replace("\uFEFF", "").strip()).replaceAll(" ");
    }

    private static String lookupKey(String header) {
        return normalizeHeader(header).toLowerCase(Locale.ROOT);
    }
}
