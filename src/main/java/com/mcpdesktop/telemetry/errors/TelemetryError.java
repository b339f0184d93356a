package com.mcpdesktop.telemetry.errors;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.mcpdesktop.telemetry.model.ContextSanitizer;
import com.mcpdesktop.telemetry.model.TelemetryRecord;

/**
 * Standardized error produced by {@link ErrorFactory}. {@code recursionLimited} marks the placeholder returned when
 * error creation nested too deeply; such errors are never published.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TelemetryError(
	String id,
	String category,
	String message,
	Severity severity,
	Map<String, Object> context,
	Instant timestamp,
	String traceId,
	String userId,
	String deviceId,
	boolean recursionLimited) {

	public TelemetryError {
		Objects.requireNonNull(id, "id");
		Objects.requireNonNull(timestamp, "timestamp");
		category = category == null ? ErrorCategory.SYSTEM.value() : category;
		message = message == null ? "" : message;
		severity = severity == null ? Severity.ERROR : severity;
		context = ContextSanitizer.sanitize(context);
	}

	/** Log record view of this error, attributed to {@code source}. */
	public TelemetryRecord toRecord(String source) {
		return new TelemetryRecord(
			id,
			timestamp,
			severity.logLevel(),
			category,
			message,
			context,
			traceId,
			userId,
			deviceId,
			severity.value(),
			source);
	}
}
