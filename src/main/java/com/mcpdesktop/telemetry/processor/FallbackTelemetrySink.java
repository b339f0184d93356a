package com.mcpdesktop.telemetry.processor;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mcpdesktop.telemetry.errors.TelemetryError;
import com.mcpdesktop.telemetry.model.Origin;

/**
 * Logging-only sink. Serves producers before the pipeline is started and is the local channel for failures the
 * pipeline cannot report through itself (persistence errors, transport errors).
 */
public class FallbackTelemetrySink implements TelemetrySink {

	private static final Logger log = LoggerFactory.getLogger("mcp.telemetry.fallback");

	@Override
	public void debug(String message, Map<String, ?> context, String category, Origin origin) {
		log.debug("[{}] {} {}", category, message, context);
	}

	@Override
	public void info(String message, Map<String, ?> context, String category, Origin origin) {
		log.info("[{}] {} {}", category, message, context);
	}

	@Override
	public void warn(String message, Map<String, ?> context, String category, Origin origin) {
		log.warn("[{}] {} {}", category, message, context);
	}

	@Override
	public void error(String message, Map<String, ?> context, String category, Origin origin) {
		log.error("[{}] {} {}", category, message, context);
	}

	@Override
	public void logError(TelemetryError error) {
		if (error == null) return;
		log.error("[{}] {} id={} severity={} {}",
			error.category(), error.message(), error.id(), error.severity().value(), error.context());
	}

	@Override
	public void trackMetric(String name, double value, Map<String, ?> context, Origin origin) {
		log.debug("metric {}={} {}", name, value, context);
	}

	/** Reports an internal pipeline failure with its cause. */
	public void internalFailure(String message, Throwable cause) {
		log.error(message, cause);
	}
}
