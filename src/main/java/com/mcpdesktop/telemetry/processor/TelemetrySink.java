package com.mcpdesktop.telemetry.processor;

import java.util.Map;

import com.mcpdesktop.telemetry.errors.TelemetryError;
import com.mcpdesktop.telemetry.model.Origin;

/**
 * Producer-facing telemetry entry points. Calls never fail and never block on I/O; records may be dropped silently
 * by throttling, deduplication, noise filtering or memory emergency.
 */
public interface TelemetrySink {

	void debug(String message, Map<String, ?> context, String category, Origin origin);

	void info(String message, Map<String, ?> context, String category, Origin origin);

	void warn(String message, Map<String, ?> context, String category, Origin origin);

	void error(String message, Map<String, ?> context, String category, Origin origin);

	/** Records an error built by the error factory, keeping its id, severity and trace id. */
	void logError(TelemetryError error);

	void trackMetric(String name, double value, Map<String, ?> context, Origin origin);

	// === Convenience overloads without correlation ids ===

	default void debug(String message, Map<String, ?> context, String category) {
		debug(message, context, category, Origin.NONE);
	}

	default void info(String message, Map<String, ?> context, String category) {
		info(message, context, category, Origin.NONE);
	}

	default void warn(String message, Map<String, ?> context, String category) {
		warn(message, context, category, Origin.NONE);
	}

	default void error(String message, Map<String, ?> context, String category) {
		error(message, context, category, Origin.NONE);
	}

	default void trackMetric(String name, double value, Map<String, ?> context) {
		trackMetric(name, value, context, Origin.NONE);
	}
}
