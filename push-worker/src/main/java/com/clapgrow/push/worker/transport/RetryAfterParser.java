package com.clapgrow.push.worker.transport;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Parses the HTTP Retry-After header into seconds.
 * 
 * Accepts both forms allowed by RFC 7231: a delta in seconds ("120") or an
 * HTTP date ("Wed, 21 Oct 2026 07:28:00 GMT").
 */
@Slf4j
final class RetryAfterParser {

    private RetryAfterParser() {
    }

    /**
     * @return seconds to wait (never negative), or null if the header is absent or unparseable
     */
    static Integer parse(String header, Clock clock) {
        if (header == null || header.isBlank()) {
            return null;
        }
        String value = header.trim();
        try {
            return Math.max(Integer.parseInt(value), 0);
        } catch (NumberFormatException e) {
            // not a delta, try the date form
        }
        try {
            ZonedDateTime retryAt = ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME);
            long seconds = Duration.between(clock.instant(), retryAt.toInstant()).getSeconds();
            return (int) Math.max(Math.min(seconds, Integer.MAX_VALUE), 0);
        } catch (DateTimeParseException e) {
            log.warn("Unparseable Retry-After header: {}", value);
            return null;
        }
    }
}
