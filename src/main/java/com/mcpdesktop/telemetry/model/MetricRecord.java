package com.mcpdesktop.telemetry.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonInclude;

/** Immutable numeric sample. Metrics are never deduplicated. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MetricRecord(
	String id, String name, double value, Map<String, Object> context, Instant timestamp, String userId, String deviceId)
	implements TelemetryEntry {

	public MetricRecord {
		Objects.requireNonNull(id, "id");
		Objects.requireNonNull(name, "name");
		Objects.requireNonNull(timestamp, "timestamp");
		context = ContextSanitizer.sanitize(context);
	}
}
