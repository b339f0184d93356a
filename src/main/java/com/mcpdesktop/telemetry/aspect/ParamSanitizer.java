package com.mcpdesktop.telemetry.aspect;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Prepares operation arguments for logging. Values under credential-like names are replaced by
 * {@value #REDACTED}; nested maps are treated the same way; other objects are reduced to their type name so that
 * whole domain objects never end up in telemetry.
 */
public final class ParamSanitizer {

	public static final String REDACTED = "[REDACTED]";

	static final List<String> SENSITIVE_FRAGMENTS =
		List.of("password", "token", "secret", "key", "auth", "credential", "api_key");

	private ParamSanitizer() {}

	public static Map<String, Object> sanitize(Map<String, ?> params) {
		Map<String, Object> out = new LinkedHashMap<>();
		if (params == null) return out;
		params.forEach((k, v) -> out.put(k, isSensitive(k) ? REDACTED : describe(v)));
		return out;
	}

	public static boolean isSensitive(String name) {
		if (name == null) return false;
		String lower = name.toLowerCase(Locale.ROOT);
		for (String fragment : SENSITIVE_FRAGMENTS) {
			if (lower.contains(fragment)) return true;
		}
		return false;
	}

	private static Object describe(Object v) {
		if (v == null || v instanceof Number || v instanceof Boolean) return v;
		if (v instanceof CharSequence || v instanceof Enum<?>) return v.toString();
		if (v instanceof Map<?, ?> m) {
			Map<String, Object> nested = new LinkedHashMap<>();
			m.forEach((k, val) -> nested.put(String.valueOf(k), val));
			return sanitize(nested);
		}
		if (v instanceof Collection<?> c) {
			return v.getClass().getSimpleName() + "[" + c.size() + "]";
		}
		return v.getClass().getSimpleName();
	}
}
