package com.mcpdesktop.telemetry.errors;

import java.time.Instant;
import java.util.Map;

/** The subset of a {@link TelemetryError} that is safe to return to API clients. */
public record ApiError(
	String id, String category, String message, Severity severity, Map<String, Object> context, Instant timestamp) {

	public static ApiError from(TelemetryError error) {
		return new ApiError(
			error.id(), error.category(), error.message(), error.severity(), error.context(), error.timestamp());
	}
}
