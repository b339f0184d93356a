package com.mcpdesktop.telemetry.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ContextSanitizerTest {

	@Test
	@DisplayName("credential keys are removed case-insensitively, at any depth, keeping order")
	void strips_sensitive_keys() {
		Map<String, Object> ctx = new LinkedHashMap<>();
		ctx.put("calendarId", "primary");
		ctx.put("Password", "hunter2");
		ctx.put("ACCESSTOKEN", "abc");
		ctx.put("auth", Map.of("clientSecret", "s", "tenant", "contoso"));
		ctx.put("attempt", 2);

		Map<String, Object> out = ContextSanitizer.sanitize(ctx);

		assertThat(out).containsOnlyKeys("calendarId", "auth", "attempt");
		assertThat(out.keySet()).containsExactly("calendarId", "auth", "attempt");
		assertThat(out.get("auth")).isEqualTo(Map.of("tenant", "contoso"));
	}

	@Test
	@DisplayName("only exact key names count as sensitive")
	void exact_match_only() {
		assertThat(ContextSanitizer.isSensitive("refreshToken")).isTrue();
		assertThat(ContextSanitizer.isSensitive("tokenCount")).isFalse();
	}

	@Test
	@DisplayName("the result is an unmodifiable copy; null gives an empty map")
	void unmodifiable_copy() {
		Map<String, Object> ctx = new LinkedHashMap<>();
		ctx.put("a", 1);
		Map<String, Object> out = ContextSanitizer.sanitize(ctx);
		ctx.put("b", 2);

		assertThat(out).containsOnlyKeys("a");
		assertThatThrownBy(() -> out.put("c", 3)).isInstanceOf(UnsupportedOperationException.class);
		assertThat(ContextSanitizer.sanitize(null)).isEmpty();
	}

	@Test
	@DisplayName("records sanitize their context and default missing text fields")
	void record_construction() {
		TelemetryRecord r = new TelemetryRecord(
			"id-1", Instant.EPOCH, LogLevel.ERROR, null, null, Map.of("token", "t"), null, null, null, null,
			TelemetryRecord.PIPELINE_SOURCE);

		assertThat(r.category()).isEmpty();
		assertThat(r.message()).isEmpty();
		assertThat(r.context()).isEmpty();
		assertThat(r.builtByPipeline()).isTrue();
		assertThat(r.withTraceId("t-1").traceId()).isEqualTo("t-1");
		assertThat(r.level().eventName()).isEqualTo(EventTypes.LOG_ERROR);
	}
}
