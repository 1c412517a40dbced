package com.tazrim.ledger.counterparty;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonical dedup keys for counterparty names: case-folded, punctuation replaced by spaces,
 * whitespace collapsed. {@code canonicalize(canonicalize(s)) == canonicalize(s)}.
 * A name with no letters or digits ("***", "--") maps to {@link #UNKNOWN_KEY} and is filed under
 * the same counterparty as rows with no name at all.
 */
public final class CounterpartyKeys {

    public static final String UNKNOWN_KEY = "unknown";

    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{M}\\p{N}\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private CounterpartyKeys() {
    }

    public static String canonicalize(String raw) {
        if (raw == null) {
            return UNKNOWN_KEY;
        }
        String folded = raw.toUpperCase(Locale.ROOT).toLowerCase(Locale.ROOT);
        String stripped = NON_WORD.matcher(folded).replaceAll(" ");
        String collapsed = WHITESPACE.matcher(stripped).replaceAll(" ").strip();
        return collapsed.isEmpty() ? UNKNOWN_KEY : collapsed;
    }
}
