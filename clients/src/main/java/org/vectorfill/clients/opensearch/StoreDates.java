package org.vectorfill.clients.opensearch;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.function.Function;

import com.fasterxml.jackson.databind.JsonNode;

import lombok.extern.slf4j.Slf4j;

/**
 * Reads the date formats found in search indices: epoch millis, ISO instants with or without an
 * offset, and plain dates. Unreadable values are treated as absent.
 */
@Slf4j
final class StoreDates {

    private static final List<Function<String, Instant>> FORMATS = List.of(
        value -> OffsetDateTime.parse(value).toInstant(),
        value -> LocalDateTime.parse(value).toInstant(ZoneOffset.UTC),
        value -> LocalDate.parse(value).atStartOfDay(ZoneOffset.UTC).toInstant()
    );

    private StoreDates() {}

    static Instant parse(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isNumber()) {
            return Instant.ofEpochMilli(node.asLong());
        }
        return parse(node.asText());
    }

    static Instant parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        DateTimeParseException lastFailure = null;
        for (var format : FORMATS) {
            try {
                return format.apply(value);
            } catch (DateTimeParseException e) {
                lastFailure = e;
            }
        }
        log.atDebug().setMessage("Ignoring unreadable date {}").addArgument(value).setCause(lastFailure).log();
        return null;
    }
}
