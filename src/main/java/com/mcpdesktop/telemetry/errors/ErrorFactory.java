package com.mcpdesktop.telemetry.errors;

import java.time.Clock;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mcpdesktop.telemetry.dispatch.EmitOptions;
import com.mcpdesktop.telemetry.dispatch.EventBus;
import com.mcpdesktop.telemetry.model.ContextSanitizer;
import com.mcpdesktop.telemetry.model.EventTypes;
import com.mcpdesktop.telemetry.utils.TelemetryIds;

/**
 * Builds standardized errors and announces them on the bus.
 *
 * <p>Each created error is published twice: as a {@link TelemetryError} on {@code error:created}, and as a log record
 * attributed to {@value #SOURCE} on {@code log:ingest}, which is how it reaches the telemetry pipeline. Live log
 * subscribers see the record only once the pipeline has let it through. Publication is
 * synchronous, so a listener that itself creates errors nests inside this call; nesting deeper than
 * {@value #MAX_DEPTH} levels yields an unpublished "recursion limit" error instead.
 */
public class ErrorFactory {

	private static final Logger log = LoggerFactory.getLogger(ErrorFactory.class);

	public static final String SOURCE = "error-service";
	static final int MAX_DEPTH = 3;

	private final EventBus bus;
	private final Clock clock;
	private final ThreadLocal<int[]> depth = ThreadLocal.withInitial(() -> new int[1]);

	public ErrorFactory(EventBus bus) {
		this(bus, Clock.systemUTC());
	}

	public ErrorFactory(EventBus bus, Clock clock) {
		this.bus = bus;
		this.clock = clock;
	}

	public TelemetryError createError(ErrorCategory category, String message, Severity severity) {
		return createError(category.value(), message, severity, Map.of(), null, null, null);
	}

	public TelemetryError createError(
		ErrorCategory category, String message, Severity severity, Map<String, ?> context) {
		return createError(category.value(), message, severity, context, null, null, null);
	}

	public TelemetryError createError(
		String category,
		String message,
		Severity severity,
		Map<String, ?> context,
		String traceId,
		String userId,
		String deviceId) {

		final int[] level = depth.get();
		if (level[0] >= MAX_DEPTH) {
			log.error("Error recursion limit reached while creating '{}' error: {}", category, message);
			return new TelemetryError(
				TelemetryIds.newId(clock),
				ErrorCategory.SYSTEM.value(),
				"Error recursion limit reached",
				Severity.ERROR,
				Map.of("originalCategory", String.valueOf(category), "originalMessage", String.valueOf(message)),
				clock.instant(),
				traceId,
				userId,
				deviceId,
				true);
		}

		level[0]++;
		try {
			TelemetryError error = new TelemetryError(
				TelemetryIds.newId(clock),
				category,
				message,
				severity,
				ContextSanitizer.sanitize(context),
				clock.instant(),
				traceId,
				userId,
				deviceId,
				false);
			publish(error);
			return error;
		} finally {
			if (--level[0] == 0) depth.remove();
		}
	}

	/** Strips everything but the fields meant for API clients. */
	public ApiError toApiError(TelemetryError error) {
		return ApiError.from(error);
	}

	private void publish(TelemetryError error) {
		final EmitOptions scope = new EmitOptions(error.userId(), error.deviceId());
		try {
			bus.emit(EventTypes.ERROR_CREATED, error, scope);
			bus.emit(EventTypes.LOG_INGEST, error.toRecord(SOURCE), scope);
		} catch (RuntimeException ex) {
			log.error("Failed to publish error id={} category='{}'", error.id(), error.category(), ex);
		}
	}
}
