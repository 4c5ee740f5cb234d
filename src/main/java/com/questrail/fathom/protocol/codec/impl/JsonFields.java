package com.questrail.fathom.protocol.codec.impl;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;

/**
 * Wire field names and timestamp formatting shared by the JSON encoder and decoder.
 */
final class JsonFields
{
    static final String VERSION = "v";
    static final String TYPE = "type";
    static final String ID = "id";
    static final String TIMESTAMP = "ts";
    static final String PAYLOAD = "payload";

    static final String LANGUAGE = "language";
    static final String CODE = "code";
    static final String STDIN = "stdin";
    static final String ENV = "env";
    static final String LIMITS = "limits";
    static final String TIMEOUT_MS = "timeout_ms";
    static final String MEMORY_MB = "memory_mb";
    static final String CPU_SHARES = "cpu_shares";
    static final String MAX_OUTPUT_BYTES = "max_output_bytes";

    static final String STATUS = "status";
    static final String DATA = "data";

    static final String EXIT_CODE = "exit_code";
    static final String DURATION_MS = "duration_ms";
    static final String RESOURCE_USAGE = "resource_usage";
    static final String PEAK_MEMORY_BYTES = "peak_memory_bytes";
    static final String CPU_TIME_MS = "cpu_time_ms";

    static final String ERROR_CODE = "code";
    static final String MESSAGE = "message";
    static final String RETRYABLE = "retryable";

    static final String LOAD = "load";
    static final String ACTIVE_EXECUTIONS = "active_executions";
    static final String QUEUE_DEPTH = "queue_depth";

    // ISO-8601, UTC, always three fractional digits.
    private static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    private JsonFields() {}

    static String formatTimestamp(Instant instant) {
        return TIMESTAMP_FORMAT.format(instant.truncatedTo(ChronoUnit.MILLIS));
    }

    static Instant parseTimestamp(String text) {
        return OffsetDateTime.parse(text, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant();
    }
}
