package com.delta.opportunities.pipeline.cli;

import com.delta.opportunities.pipeline.model.OpportunityType;
import com.delta.opportunities.pipeline.model.RawOpportunity;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.Reader;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads scraper exports into raw opportunities. List columns are separated by {@code ;}.
 * Rows that cannot be read are reported, not thrown.
 */
public class OpportunityCsvReader {

    public record ReadResult(List<RawOpportunity> opportunities, List<String> errors) {
    }

    public ReadResult read(Reader reader) throws IOException {
        List<RawOpportunity> opportunities = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        try (CSVParser parser = csvParser(reader)) {
            for (CSVRecord record : parser) {
                try {
                    opportunities.add(toRaw(record));
                } catch (IllegalArgumentException | DateTimeParseException e) {
                    errors.add("csv row " + record.getRecordNumber() + ": " + e.getMessage());
                }
            }
        }
        return new ReadResult(opportunities, errors);
    }

    private RawOpportunity toRaw(CSVRecord record) {
        String remote = getColumn(record, "remote");
        return new RawOpportunity(
            getColumn(record, "source"),
            getColumn(record, "external_id", "externalId", "id"),
            getColumn(record, "title"),
            getColumn(record, "organization", "company"),
            getColumn(record, "url"),
            getColumn(record, "description"),
            OpportunityType.fromRaw(getColumn(record, "type", "opportunity_type")),
            parseDeadline(getColumn(record, "deadline")),
            getColumn(record, "location"),
            remote == null ? null : Boolean.valueOf(remote.toLowerCase(Locale.ROOT).equals("true") || remote.equals("1")),
            splitList(getColumn(record, "tags")),
            splitList(getColumn(record, "required_skills", "skills")),
            parseInteger(getColumn(record, "required_experience_years", "experience_years")),
            parseDouble(getColumn(record, "salary_min")),
            parseDouble(getColumn(record, "salary_max")),
            getColumn(record, "application_platform", "platform"),
            Map.of()
        );
    }

    private CSVParser csvParser(Reader reader) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreSurroundingSpaces(true)
            .build();
        return format.parse(reader);
    }

    private String getColumn(CSVRecord record, String... names) {
        for (String name : names) {
            for (String header : record.toMap().keySet()) {
                if (header == null) {
                    continue;
                }
                if (header.trim().equalsIgnoreCase(name)) {
                    String value = record.get(header).trim();
                    return value.isEmpty() ? null : value;
                }
            }
        }
        return null;
    }

    static Instant parseDeadline(String value) {
        if (value == null) {
            return null;
        }
        if (value.length() == 10) {
            return LocalDate.parse(value).atStartOfDay(ZoneOffset.UTC).toInstant();
        }
        return Instant.parse(value);
    }

    private static List<String> splitList(String value) {
        if (value == null) {
            return List.of();
        }
        return Arrays.stream(value.split(";"))
            .map(String::trim)
            .filter(s -> !s.isBlank())
            .toList();
    }

    private static Integer parseInteger(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("not a whole number: " + value);
        }
    }

    private static Double parseDouble(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("not a number: " + value);
        }
    }
}
