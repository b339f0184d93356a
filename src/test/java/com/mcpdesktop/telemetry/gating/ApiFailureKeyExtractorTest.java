package com.mcpdesktop.telemetry.gating;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.mcpdesktop.telemetry.model.LogLevel;
import com.mcpdesktop.telemetry.support.Records;

class ApiFailureKeyExtractorTest {

	private final ApiFailureKeyExtractor extractor = new ApiFailureKeyExtractor();

	@Test
	@DisplayName("operation words and status survive; identifiers are dropped")
	void key_from_message() {
		String key = extractor.keyFor(Records.record(
			LogLevel.ERROR, "graph", "API request failed: cancel event AAMkAGI2ZjE0 404 - Not Found"));

		assertThat(key).isEqualTo("graph:error:api-failure:cancel-event:404");
	}

	@Test
	@DisplayName("messages without a status code get 'unknown'")
	void missing_status() {
		String key = extractor.keyFor(Records.record(LogLevel.ERROR, "calendar", "API request failed: timeout"));

		assertThat(key).isEqualTo("calendar:error:api-failure:timeout:unknown");
	}

	@Test
	@DisplayName("unrelated messages are left to the default key")
	void not_applicable() {
		assertThat(extractor.keyFor(Records.record(LogLevel.ERROR, "graph", "token refresh failed"))).isNull();
	}

	@Test
	@DisplayName("long opaque tokens are treated as identifiers even without digits")
	void long_tokens_dropped() {
		assertThat(ApiFailureKeyExtractor.operation(" update event abcdefghijklmnopqrstuvwxyzABCDEF "))
			.isEqualTo("update-event");
		assertThat(ApiFailureKeyExtractor.operation(" ")).isEqualTo("request");
	}
}
