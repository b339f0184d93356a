package com.mcpdesktop.telemetry.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Removes credential-bearing keys from a context map before it is stored, persisted or broadcast. Key matching is
 * exact and case-insensitive; nested maps are cleaned the same way. The result is an unmodifiable copy that keeps the
 * caller's insertion order.
 */
public final class ContextSanitizer {

	static final Set<String> SENSITIVE_KEYS =
		Set.of("password", "token", "secret", "accesstoken", "refreshtoken", "clientsecret");

	private ContextSanitizer() {}

	public static Map<String, Object> sanitize(Map<String, ?> context) {
		if (context == null || context.isEmpty()) return Map.of();
		Map<String, Object> out = new LinkedHashMap<>(context.size());
		for (Map.Entry<String, ?> e : context.entrySet()) {
			String key = e.getKey();
			if (key == null || isSensitive(key)) continue;
			out.put(key, cleanValue(e.getValue()));
		}
		return Collections.unmodifiableMap(out);
	}

	public static boolean isSensitive(String key) {
		return SENSITIVE_KEYS.contains(key.toLowerCase(Locale.ROOT));
	}

	private static Object cleanValue(Object value) {
		if (value instanceof Map<?, ?> nested) {
			Map<String, Object> asStringKeys = new LinkedHashMap<>();
			for (Map.Entry<?, ?> e : nested.entrySet()) {
				if (e.getKey() != null) asStringKeys.put(String.valueOf(e.getKey()), e.getValue());
			}
			return sanitize(asStringKeys);
		}
		return value;
	}
}
