package com.mcpdesktop.telemetry.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Immutable log record flowing through the pipeline.
 *
 * <p>The context is sanitized and copied at construction, so a record can be shared with any number of subscribers.
 * {@code severity} is only set for records derived from a created error; {@code source} names the producer that
 * published the record on the bus, or {@link #PIPELINE_SOURCE} for records built by the pipeline itself.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TelemetryRecord(
	String id,
	Instant timestamp,
	LogLevel level,
	String category,
	String message,
	Map<String, Object> context,
	String traceId,
	String userId,
	String deviceId,
	String severity,
	String source)
	implements TelemetryEntry {

	public static final String PIPELINE_SOURCE = "pipeline";

	public TelemetryRecord {
		Objects.requireNonNull(id, "id");
		Objects.requireNonNull(timestamp, "timestamp");
		Objects.requireNonNull(level, "level");
		category = category == null ? "" : category;
		message = message == null ? "" : message;
		context = ContextSanitizer.sanitize(context);
	}

	/** True when the pipeline itself built this record (as opposed to receiving it from the bus). */
	public boolean builtByPipeline() {
		return PIPELINE_SOURCE.equals(source);
	}

	public TelemetryRecord withTraceId(String newTraceId) {
		return new TelemetryRecord(
			id, timestamp, level, category, message, context, newTraceId, userId, deviceId, severity, source);
	}
}
