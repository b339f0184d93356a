package com.mcpdesktop.telemetry.processor;

import java.util.Collection;
import java.util.List;
import java.util.Map;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;

import com.mcpdesktop.telemetry.model.TelemetryRecord;

/**
 * Bridges telemetry records and the active OpenTelemetry span: supplies a trace id when the producer gave none, and
 * attaches error records to the span as events. Without an active span both are no-ops.
 */
public class TraceCorrelation {

	static final String ERROR_EVENT = "telemetry.error";
	static final String CONTEXT_PREFIX = "telemetry.context.";

	/** Trace id of the current span, or null when no valid span is active. */
	public String currentTraceId() {
		SpanContext sc = Span.current().getSpanContext();
		return sc.isValid() ? sc.getTraceId() : null;
	}

	public void recordError(TelemetryRecord record) {
		Span span = Span.current();
		if (!span.isRecording()) return;
		span.addEvent(ERROR_EVENT, toAttributes(record));
	}

	static Attributes toAttributes(TelemetryRecord r) {
		AttributesBuilder b = Attributes.builder()
			.put(AttributeKey.stringKey("telemetry.record_id"), r.id())
			.put(AttributeKey.stringKey("telemetry.category"), r.category())
			.put(AttributeKey.stringKey("telemetry.level"), r.level().label())
			.put(AttributeKey.stringKey("telemetry.message"), r.message());
		if (r.severity() != null) b.put(AttributeKey.stringKey("telemetry.severity"), r.severity());
		for (Map.Entry<String, Object> e : r.context().entrySet()) {
			put(b, CONTEXT_PREFIX + e.getKey(), e.getValue());
		}
		return b.build();
	}

	private static void put(AttributesBuilder b, String key, Object value) {
		if (value == null) return;
		if (value instanceof Boolean flag) {
			b.put(AttributeKey.booleanKey(key), flag);
		} else if (value instanceof Number n) {
			if (n instanceof Double || n instanceof Float) b.put(AttributeKey.doubleKey(key), n.doubleValue());
			else b.put(AttributeKey.longKey(key), n.longValue());
		} else if (value instanceof Collection<?> items) {
			List<String> strings = items.stream().map(String::valueOf).toList();
			b.put(AttributeKey.stringArrayKey(key), strings);
		} else {
			b.put(AttributeKey.stringKey(key), String.valueOf(value));
		}
	}
}
