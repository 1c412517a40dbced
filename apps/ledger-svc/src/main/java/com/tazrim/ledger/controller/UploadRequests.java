package com.tazrim.ledger.controller;

import com.tazrim.ledger.ingest.FeedKind;
import com.tazrim.ledger.service.StatementUpload;
import java.io.IOException;
import java.util.Locale;
import org.springframework.web.multipart.MultipartFile;

final class UploadRequests {

    private UploadRequests() {
    }

    static StatementUpload toUpload(MultipartFile file, String account, String period, String feedKind) throws IOException {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("file must not be empty");
        }
        String filename = file.getOriginalFilename();
        if (filename == null || filename.isBlank()) {
            filename = file.getName();
        }
        return new StatementUpload(account, period, filename, parseFeedKind(feedKind), file.getBytes());
    }

    static FeedKind parseFeedKind(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return FeedKind.valueOf(value.strip().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown feed kind: " + value, ex);
        }
    }
}
