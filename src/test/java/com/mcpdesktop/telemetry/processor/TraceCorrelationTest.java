package com.mcpdesktop.telemetry.processor;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import io.opentelemetry.sdk.testing.exporter.InMemorySpanExporter;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.data.EventData;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SimpleSpanProcessor;

import com.mcpdesktop.telemetry.dispatch.EventBus;
import com.mcpdesktop.telemetry.gating.DedupFilter;
import com.mcpdesktop.telemetry.memory.MemoryGuardian;
import com.mcpdesktop.telemetry.model.LogLevel;
import com.mcpdesktop.telemetry.model.TelemetryRecord;
import com.mcpdesktop.telemetry.store.LogQuery;
import com.mcpdesktop.telemetry.support.MutableClock;
import com.mcpdesktop.telemetry.support.Records;

class TraceCorrelationTest {

	private InMemorySpanExporter exporter;
	private SdkTracerProvider provider;
	private Tracer tracer;
	private final TraceCorrelation traces = new TraceCorrelation();

	@BeforeEach
	void setUp() {
		exporter = InMemorySpanExporter.create();
		provider = SdkTracerProvider.builder().addSpanProcessor(SimpleSpanProcessor.create(exporter)).build();
		tracer = provider.get("telemetry-test");
	}

	@AfterEach
	void tearDown() {
		provider.close();
	}

	@Test
	@DisplayName("no active span: no trace id and recordError is a no-op")
	void without_span() {
		assertThat(traces.currentTraceId()).isNull();

		traces.recordError(Records.record(LogLevel.ERROR, "system", "boom"));

		assertThat(exporter.getFinishedSpanItems()).isEmpty();
	}

	@Test
	@DisplayName("error records become events on the active span")
	void error_event_on_span() {
		Span span = tracer.spanBuilder("sync-calendar").startSpan();
		String traceId;
		try (Scope ignored = span.makeCurrent()) {
			traceId = traces.currentTraceId();
			traces.recordError(Records.record(
				LogLevel.ERROR, "calendar", "sync failed", Map.of("statusCode", 503, "retry", true)));
		} finally {
			span.end();
		}

		assertThat(traceId).isEqualTo(span.getSpanContext().getTraceId());
		List<SpanData> spans = exporter.getFinishedSpanItems();
		assertThat(spans).hasSize(1);
		EventData event = spans.get(0).getEvents().get(0);
		assertThat(event.getName()).isEqualTo(TraceCorrelation.ERROR_EVENT);
		assertThat(event.getAttributes().get(AttributeKey.stringKey("telemetry.category"))).isEqualTo("calendar");
		assertThat(event.getAttributes().get(AttributeKey.longKey("telemetry.context.statusCode"))).isEqualTo(503L);
		assertThat(event.getAttributes().get(AttributeKey.booleanKey("telemetry.context.retry"))).isTrue();
	}

	@Test
	@DisplayName("context values are mapped to the closest attribute type")
	void attribute_mapping() {
		Map<String, Object> ctx = new LinkedHashMap<>();
		ctx.put("ratio", 0.5);
		ctx.put("tags", List.of("a", "b"));
		ctx.put("when", Duration.ofSeconds(2));

		Attributes attrs = TraceCorrelation.toAttributes(Records.record(LogLevel.ERROR, "system", "m", ctx));

		assertThat(attrs.get(AttributeKey.doubleKey("telemetry.context.ratio"))).isEqualTo(0.5);
		assertThat(attrs.get(AttributeKey.stringArrayKey("telemetry.context.tags"))).containsExactly("a", "b");
		assertThat(attrs.get(AttributeKey.stringKey("telemetry.context.when"))).isEqualTo("PT2S");
		assertThat(attrs.get(AttributeKey.stringKey("telemetry.level"))).isEqualTo("error");
	}

	@Test
	@DisplayName("records logged inside a span inherit its trace id")
	void pipeline_fills_trace_id() {
		MutableClock clock = new MutableClock();
		TelemetryPipeline pipeline = TelemetryPipeline.builder(new EventBus())
			.clock(clock)
			.dedup(new DedupFilter(DedupFilter.Settings.defaults(), clock, () -> 1.0))
			.guardian(new MemoryGuardian(MemoryGuardian.Settings.defaults(), () -> 0.1, clock, () -> {}))
			.persistenceExecutor(Runnable::run)
			.traces(traces)
			.build();

		Span span = tracer.spanBuilder("request").startSpan();
		try (Scope ignored = span.makeCurrent()) {
			pipeline.info("inside", Map.of(), "api");
		} finally {
			span.end();
			pipeline.close();
		}
		pipeline.info("outside", Map.of(), "module");

		List<TelemetryRecord> records = pipeline.queryLogs(LogQuery.all());
		assertThat(records)
			.filteredOn(r -> r.message().equals("inside"))
			.singleElement()
			.extracting(TelemetryRecord::traceId)
			.isEqualTo(span.getSpanContext().getTraceId());
		assertThat(records)
			.filteredOn(r -> r.message().equals("outside"))
			.singleElement()
			.extracting(TelemetryRecord::traceId)
			.isNull();
	}
}
