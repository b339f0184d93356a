package com.mcpdesktop.telemetry.gating;

import java.util.Locale;
import java.util.StringJoiner;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.mcpdesktop.telemetry.model.TelemetryRecord;

/**
 * Collapses cloud-API failure messages by operation and HTTP status, ignoring the resource ids they mention.
 *
 * <p>"API request failed: cancel event AAMkAGI2ZjE0 404 - Not Found" and the same failure for any other event id
 * produce the same key, {@code graph:error:api-failure:cancel-event:404}. Tokens that contain a digit or are longer
 * than {@value #MAX_WORD_LENGTH} characters are treated as identifiers and dropped from the operation.
 */
public class ApiFailureKeyExtractor implements DedupKeyExtractor {

	static final String MARKER = "API request failed";
	static final int MAX_WORD_LENGTH = 24;

	private static final Pattern STATUS = Pattern.compile("(\\d{3})\\s*-\\s*([^:]+)");
	private static final Pattern SEPARATORS = Pattern.compile("[\\s:/,;()\\[\\]'\"]+");
	private static final Pattern HAS_DIGIT = Pattern.compile(".*\\d.*");

	@Override
	public String keyFor(TelemetryRecord record) {
		final String message = record.message();
		final int idx = message.indexOf(MARKER);
		if (idx < 0) return null;

		String tail = message.substring(idx + MARKER.length());
		String status = "unknown";
		String operationText = tail;
		Matcher m = STATUS.matcher(tail);
		if (m.find()) {
			status = m.group(1);
			operationText = tail.substring(0, m.start());
		}
		return record.category() + ":" + record.level().label() + ":api-failure:" + operation(operationText) + ":"
			+ status;
	}

	static String operation(String text) {
		StringJoiner words = new StringJoiner("-");
		for (String token : SEPARATORS.split(text)) {
			if (token.isEmpty() || token.length() > MAX_WORD_LENGTH || HAS_DIGIT.matcher(token).matches()) continue;
			words.add(token.toLowerCase(Locale.ROOT));
		}
		String op = words.toString();
		return op.isEmpty() ? "request" : op;
	}
}
