package com.tazrim.ledger.draft;

import java.util.List;

public record DraftPage(DraftView draft, List<DraftRowView> rows, int page, int size, long totalRows) {
}
