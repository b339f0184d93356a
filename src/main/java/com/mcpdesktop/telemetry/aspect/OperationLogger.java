package com.mcpdesktop.telemetry.aspect;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

import lombok.RequiredArgsConstructor;

import com.mcpdesktop.telemetry.model.Origin;
import com.mcpdesktop.telemetry.processor.TelemetrySink;

/**
 * Standard records for module and service operations: "called", "completed in", "Error in", plus a duration metric.
 * Used by {@link MonitoredOperationAspect}; components that cannot be proxied call it directly.
 */
@RequiredArgsConstructor
public class OperationLogger {

	private final TelemetrySink sink;

	public void logMethodEntry(OperationOptions op, Map<String, ?> params, String requestId) {
		Map<String, Object> ctx = baseContext(op, requestId);
		if (op.logParams() && params != null && !params.isEmpty()) {
			ctx.put("params", ParamSanitizer.sanitize(params));
		}
		sink.info(op.label() + " called", ctx, op.category(), Origin.NONE);
	}

	public void logMethodExit(OperationOptions op, Object result, double durationMs, String requestId) {
		Map<String, Object> ctx = baseContext(op, requestId);
		ctx.put("durationMs", round(durationMs));
		ctx.put("resultType", result == null ? "null" : result.getClass().getSimpleName());
		if (result instanceof Collection<?> c) ctx.put("resultSize", c.size());
		else if (result instanceof Map<?, ?> m) ctx.put("resultSize", m.size());

		sink.info(
			op.label() + " completed in " + String.format(Locale.ROOT, "%.2f", durationMs) + "ms",
			ctx,
			op.category(),
			Origin.NONE);
		trackDuration(op, durationMs);
	}

	public void logMethodError(OperationOptions op, Throwable error, double durationMs, String requestId) {
		Map<String, Object> ctx = baseContext(op, requestId);
		ctx.put("durationMs", round(durationMs));
		ctx.put("errorName", error.getClass().getSimpleName());
		ctx.put("errorMessage", String.valueOf(error.getMessage()));
		sink.error("Error in " + op.label() + ": " + error.getMessage(), ctx, op.category(), Origin.NONE);
		trackDuration(op, durationMs);
	}

	/** Debug record for a data normalization step inside an operation. */
	public void logNormalization(OperationOptions op, String inputType, Object input, Object output) {
		Map<String, Object> ctx = baseContext(op, null);
		ctx.put("inputType", inputType);
		ctx.put("inputShape", input == null ? "null" : input.getClass().getSimpleName());
		ctx.put("outputShape", output == null ? "null" : output.getClass().getSimpleName());
		sink.debug(op.label() + " normalizing " + inputType, ctx, op.category(), Origin.NONE);
	}

	/* ---- helpers ---- */

	private void trackDuration(OperationOptions op, double durationMs) {
		Map<String, Object> ctx = new LinkedHashMap<>();
		ctx.put(op.category() + "Name", op.name());
		ctx.put("method", op.method());
		sink.trackMetric(op.category() + "_" + op.method() + "_duration", durationMs, ctx, Origin.NONE);
	}

	private static Map<String, Object> baseContext(OperationOptions op, String requestId) {
		Map<String, Object> ctx = new LinkedHashMap<>();
		if (requestId != null) ctx.put("requestId", requestId);
		ctx.put("method", op.method());
		ctx.put("component", op.component().label());
		ctx.put(op.category() + "Name", op.name());
		return ctx;
	}

	private static double round(double ms) {
		return Math.round(ms * 100.0) / 100.0;
	}
}
