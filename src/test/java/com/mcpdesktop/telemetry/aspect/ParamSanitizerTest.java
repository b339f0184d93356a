package com.mcpdesktop.telemetry.aspect;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ParamSanitizerTest {

	record Attendee(String email) {}

	@Test
	@DisplayName("credential-like names are redacted at any depth; objects are reduced to their type")
	void sanitize() {
		Map<String, Object> params = new LinkedHashMap<>();
		params.put("calendarId", "primary");
		params.put("clientSecret", "s3cr3t");
		params.put("options", Map.of("apiKey", "k-1", "limit", 10));
		params.put("attendees", List.of(new Attendee("a@example.com")));
		params.put("owner", new Attendee("b@example.com"));
		params.put("dryRun", true);

		Map<String, Object> out = ParamSanitizer.sanitize(params);

		assertThat(out)
			.containsEntry("calendarId", "primary")
			.containsEntry("clientSecret", ParamSanitizer.REDACTED)
			.containsEntry("options", Map.of("apiKey", ParamSanitizer.REDACTED, "limit", 10))
			.containsEntry("owner", "Attendee")
			.containsEntry("dryRun", true);
		assertThat((String) out.get("attendees")).endsWith("[1]");
	}

	@Test
	@DisplayName("null params give an empty map")
	void null_params() {
		assertThat(ParamSanitizer.sanitize(null)).isEmpty();
	}
}
