package com.mcpdesktop.telemetry.support;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import com.mcpdesktop.telemetry.model.LogLevel;
import com.mcpdesktop.telemetry.model.TelemetryRecord;

/** Compact builders for records used across tests. */
public final class Records {

	private static final AtomicLong SEQ = new AtomicLong();
	private static final Instant BASE = Instant.parse("2024-05-01T10:00:00Z");

	private Records() {}

	public static TelemetryRecord record(LogLevel level, String category, String message) {
		return record(level, category, message, Map.of());
	}

	public static TelemetryRecord record(LogLevel level, String category, String message, Map<String, Object> ctx) {
		long n = SEQ.incrementAndGet();
		return new TelemetryRecord(
			"rec-" + n, BASE.plusMillis(n), level, category, message, ctx, null, null, null, null,
			TelemetryRecord.PIPELINE_SOURCE);
	}

	public static TelemetryRecord at(Instant ts, LogLevel level, String category, String message, String userId) {
		return new TelemetryRecord(
			"rec-" + SEQ.incrementAndGet(), ts, level, category, message, Map.of(), null, userId, null, null,
			TelemetryRecord.PIPELINE_SOURCE);
	}
}
