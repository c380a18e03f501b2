package com.opsdata.ticketingest.service;

import com.google.common.collect.ImmutableMap;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.csv.DuplicateHeaderMode;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads a ticket export CSV into raw field maps keyed by snake_case field name, so that
 * {@code "Incident ID"} and {@code "Incident_ID"} both become {@code incident_id}.
 */
@Component
public class TicketCsvReader {

    private static final char BOM = '\uFEFF';

    // Remedy column names that do not reduce to the stored field name.
    private static final Map<String, String> HEADER_ALIASES = ImmutableMap.of(
            "operational_categorization_tier_1", "operational_category_tier_1",
            "operational_categorization_tier_2", "operational_category_tier_2",
            "operational_categorization_tier_3", "operational_category_tier_3",
            "service_desk_first_assigned_date", "service_desk_1st_assigned_date",
            "service_desk_first_assigned_group", "service_desk_1st_assigned_group");

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setTrim(true)
            .setIgnoreEmptyLines(true)
            .setAllowMissingColumnNames(true)
            .setDuplicateHeaderMode(DuplicateHeaderMode.ALLOW_ALL)
            .build();

    public List<Map<String, String>> read(InputStream input) {
        try (Reader reader = new InputStreamReader(input, StandardCharsets.UTF_8);
             CSVParser parser = FORMAT.parse(reader)) {
            List<String> headerNames = parser.getHeaderNames();
            if (headerNames.isEmpty()) {
                throw new TicketIngestionException("CSV file has no header row");
            }
            List<String> fields = sanitizeHeaders(headerNames);

            List<Map<String, String>> rows = new ArrayList<>();
            for (CSVRecord record : parser) {
                Map<String, String> row = new LinkedHashMap<>();
                int width = Math.min(fields.size(), record.size());
                for (int i = 0; i < width; i++) {
                    // first occurrence of a duplicated header wins
                    row.putIfAbsent(fields.get(i), record.get(i));
                }
                rows.add(row);
            }
            return rows;
        } catch (IOException | UncheckedIOException | IllegalStateException e) {
            throw new TicketIngestionException("Unable to parse CSV: " + e.getMessage(), e);
        }
    }

    static List<String> sanitizeHeaders(List<String> headers) {
        List<String> sanitized = new ArrayList<>(headers.size());
        for (String header : headers) {
            sanitized.add(toFieldName(header));
        }
        return sanitized;
    }

    static String toFieldName(String header) {
        String value = header == null ? "" : header.trim();
        if (!value.isEmpty() && value.charAt(0) == BOM) {
            value = value.substring(1).trim();
        }
        value = value.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_]", "_");
        value = value.replaceAll("_+", "_");
        value = value.replaceAll("^_+|_+$", "");
        return HEADER_ALIASES.getOrDefault(value, value);
    }
}
