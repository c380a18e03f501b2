package com.opsdata.ticketingest.service;

import com.opsdata.ticketingest.model.NormalizedTicketRecord;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Cleans raw export values: trims, removes one layer of surrounding double quotes, and turns
 * doubled quotes ({@code ""}) back into single ones. The cleanup repeats until the value stops
 * changing, so a cleaned value is never cleaned further. Blank input becomes {@link Optional#empty()}.
 */
public final class FieldNormalizer {

    private static final String QUOTE = "\"";
    private static final String ESCAPED_QUOTE = "\"\"";

    private FieldNormalizer() {
    }

    public static Optional<String> normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String value = raw.trim();
        String previous;
        do {
            previous = value;
            value = unquote(value);
        } while (!value.equals(previous));
        // A quoted blank ("  ") is as absent as an unquoted one.
        return value.isEmpty() ? Optional.empty() : Optional.of(value);
    }

    // Each pass only shortens the value, so the loop above terminates.
    private static String unquote(String value) {
        String result = value;
        if (result.length() >= 2 && result.startsWith(QUOTE) && result.endsWith(QUOTE)) {
            result = result.substring(1, result.length() - 1);
        }
        return result.replace(ESCAPED_QUOTE, QUOTE).trim();
    }

    /**
     * Normalizes every field of a raw row, dropping the ones that end up absent. Field names are
     * trimmed; values keep their original field order.
     */
    public static NormalizedTicketRecord normalizeRecord(Map<String, String> raw) {
        Map<String, String> cleaned = new LinkedHashMap<>();
        if (raw == null) {
            return new NormalizedTicketRecord(cleaned);
        }
        raw.forEach((field, value) -> {
            if (field == null) return;
            normalize(value).ifPresent(v -> cleaned.put(field.trim(), v));
        });
        return new NormalizedTicketRecord(cleaned);
    }
}
