package com.mcpdesktop.telemetry.gating;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.mcpdesktop.telemetry.model.LogLevel;

class NoiseFilterTest {

	private final NoiseFilter development = new NoiseFilter();
	private final NoiseFilter production = new NoiseFilter(NoiseFilter.Settings.defaults(RuntimeMode.PRODUCTION));

	@Test
	@DisplayName("debug records are kept in development and dropped in production")
	void debug_by_mode() {
		assertThat(development.dropLog(LogLevel.DEBUG, "module", "tick", Map.of())).isFalse();
		assertThat(production.dropLog(LogLevel.DEBUG, "module", "tick", Map.of())).isTrue();
	}

	@Test
	@DisplayName("production drops info chatter only for the quiet categories")
	void quiet_categories() {
		assertThat(production.dropLog(LogLevel.INFO, "graph", "fetched 12 events", Map.of())).isTrue();
		assertThat(production.dropLog(LogLevel.INFO, "module", "loaded", Map.of())).isFalse();
		assertThat(production.dropLog(LogLevel.WARN, "graph", "slow response", Map.of())).isFalse();
	}

	@Test
	@DisplayName("static asset requests are dropped from request categories")
	void static_assets() {
		assertThat(development.dropLog(LogLevel.INFO, "http", "GET /assets/app.3f2a.js 200", Map.of())).isTrue();
		assertThat(development.dropLog(LogLevel.INFO, "routes", "request", Map.of("path", "/favicon.ico"))).isTrue();
		assertThat(development.dropLog(LogLevel.INFO, "http", "GET /api/events 200", Map.of())).isFalse();
		assertThat(development.dropLog(LogLevel.INFO, "module", "GET /assets/app.js", Map.of())).isFalse();
	}

	@Test
	@DisplayName("known unhelpful calendar/graph failure texts are dropped at error level")
	void unhelpful_errors() {
		assertThat(development.dropLog(LogLevel.ERROR, "graph", "Graph API request failed with no body", Map.of()))
			.isTrue();
		assertThat(development.dropLog(LogLevel.ERROR, "calendar", "Unable to read error response", Map.of()))
			.isTrue();
		assertThat(development.dropLog(LogLevel.ERROR, "database", "Unable to read error response", Map.of()))
			.isFalse();
	}

	@Test
	@DisplayName("a module registration is logged once per module id until reset")
	void module_registration_once() {
		Map<String, Object> ctx = Map.of("moduleId", "calendar");

		assertThat(development.dropLog(LogLevel.INFO, "module", "Module registered: calendar", ctx)).isFalse();
		assertThat(development.dropLog(LogLevel.INFO, "module", "Module registered: calendar", ctx)).isTrue();
		assertThat(development.dropLog(LogLevel.INFO, "module", "Module registered: mail", Map.of("moduleId", "mail")))
			.isFalse();

		development.reset();
		assertThat(development.dropLog(LogLevel.INFO, "module", "Module registered: calendar", ctx)).isFalse();
	}

	@Test
	@DisplayName("storage metrics are always dropped, fast timings only below the floor")
	void metrics() {
		assertThat(development.dropMetric("storage_write_bytes", 4096)).isTrue();
		assertThat(development.dropMetric("module_load_duration", 3.2)).isTrue();
		assertThat(development.dropMetric("module_load_duration", 42)).isFalse();
		assertThat(development.dropMetric("sync_success", 1)).isTrue();
		assertThat(development.dropMetric("events_synced", 1)).isFalse();
	}
}
