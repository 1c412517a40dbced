package com.tazrim.ledger.ingest;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

/**
 * Reads a UTF-8 statement export (optionally BOM-prefixed) into a header row and labelled data rows.
 * Bytes that are not valid UTF-8 reject the whole statement.
 */
public final class StatementReader {

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setIgnoreEmptyLines(true)
            .build();

    private StatementReader() {
    }

    public static RawStatement read(byte[] content) {
        if (content == null || content.length == 0) {
            throw new StatementFormatException("Statement is empty");
        }
        String text = decode(content);
        if (text.startsWith("\uFEFF")) {
            text = text.substring(1);
        }
        try (CSVParser parser = CSVParser.parse(text, FORMAT)) {
            Iterator<CSVRecord> records = parser.iterator();
            if (!records.hasNext()) {
                throw new StatementFormatException("Missing headers");
            }
            List<String> headers = new ArrayList<>();
            for (String label : records.next()) {
                headers.add(label == null ? "" : label.replace("\uFEFF", ""));
            }
            List<RawRow> rows = new ArrayList<>();
            int rowIndex = 2;
            while (records.hasNext()) {
                CSVRecord record = records.next();
                Map<String, String> cells = new LinkedHashMap<>();
                for (int i = 0; i < headers.size(); i++) {
                    cells.putIfAbsent(headers.get(i), i < record.size() ? record.get(i) : "");
                }
                rows.add(new RawRow(rowIndex++, Collections.unmodifiableMap(cells)));
            }
            return new RawStatement(List.copyOf(headers), List.copyOf(rows));
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read statement", ex);
        }
    }

    static String decode(byte[] content) {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        ByteBuffer buffer = ByteBuffer.wrap(content);
        try {
            return decoder.decode(buffer).toString();
        } catch (CharacterCodingException ex) {
            // the buffer stops at the offending byte
            throw new StatementEncodingException(lineAt(content, buffer.position()));
        }
    }

    private static int lineAt(byte[] content, int offset) {
        int line = 1;
        for (int i = 0; i < offset && i < content.length; i++) {
            if (content[i] == '\n') {
                line++;
            }
        }
        return line;
    }

    public record RawStatement(List<String> headers, List<RawRow> rows) {
    }

    /**
     * One data row keyed by the statement's own header labels. The header row is row 1.
     */
    public record RawRow(int rowIndex, Map<String, String> cells) {
    }
}
