package com.tazrim.ledger.ingest;

import com.tazrim.ledger.config.LedgerImportProperties;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads a statement export and parses every row. The first fatal row aborts the whole statement,
 * so callers never see a partial result.
 */
@Component
public class StatementParser {

    private static final Logger log = LoggerFactory.getLogger(StatementParser.class);

    private final MoneyParser moneyParser;
    private final String unknownCounterparty;

    public StatementParser(LedgerImportProperties properties) {
        this.moneyParser = new MoneyParser(properties.homeCurrency());
        this.unknownCounterparty = properties.unknownCounterparty();
    }

    public ParseResult parse(byte[] content) {
        return parse(content, null);
    }

    /**
     * @param forcedKind feed kind to use, or {@code null} to detect it from the header row
     */
    public ParseResult parse(byte[] content, FeedKind forcedKind) {
        StatementReader.RawStatement statement = StatementReader.read(content);
        ColumnMapping mapping = forcedKind == null
                ? FormatDetector.detect(statement.headers())
                : FormatDetector.detect(statement.headers(), forcedKind);

        RowParser rowParser = new RowParser(
                mapping,
                inferOrder(statement, mapping, CanonicalField.DATE),
                inferOrder(statement, mapping, CanonicalField.SECONDARY_DATE),
                moneyParser,
                unknownCounterparty
        );

        List<ParsedActivity> activities = new ArrayList<>();
        List<SkipRecord> skips = new ArrayList<>();
        for (StatementReader.RawRow row : statement.rows()) {
            RowOutcome outcome = rowParser.parse(row);
            if (outcome instanceof RowOutcome.Accepted accepted) {
                activities.add(accepted.activity());
            } else if (outcome instanceof RowOutcome.Skipped skipped) {
                log.debug("Skipping row {}: {}", skipped.skip().rowIndex(), skipped.skip().reason());
                skips.add(skipped.skip());
            } else if (outcome instanceof RowOutcome.Fatal fatal) {
                throw fatal.error();
            }
        }
        log.debug("Parsed {} statement: {} accepted, {} skipped", mapping.feedKind(), activities.size(), skips.size());
        return new ParseResult(mapping.feedKind(), List.copyOf(activities), List.copyOf(skips));
    }

    private static DateOrder inferOrder(StatementReader.RawStatement statement, ColumnMapping mapping, CanonicalField field) {
        if (!mapping.has(field)) {
            return DateOrder.DAY_FIRST;
        }
        List<String> values = new ArrayList<>(statement.rows().size());
        for (StatementReader.RawRow row : statement.rows()) {
            values.add(mapping.cell(row, field));
        }
        return DateOrderInference.infer(values);
    }
}
