package com.mcpdesktop.telemetry.gating;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

import com.mcpdesktop.telemetry.model.LogLevel;

/**
 * Drops routine chatter before a record is built. A dropped call is counted as {@link DropReason#FILTERED}.
 *
 * <p>Log rules:
 *
 * <ul>
 *   <li>request logs for static assets (scripts, styles, images, fonts, source maps)
 *   <li>repeated "Module registered" notices for a module id already announced
 *   <li>debug records in {@link RuntimeMode#PRODUCTION}
 *   <li>info records of the quiet categories in {@link RuntimeMode#PRODUCTION}
 *   <li>calendar/graph errors matching a known unhelpful failure text
 * </ul>
 *
 * <p>Metric rules: storage metrics (tracking them would write telemetry about writing telemetry) and performance
 * timings below the floor.
 */
public class NoiseFilter {

	static final String MODULE_REGISTERED = "Module registered";

	private static final Pattern STATIC_ASSET =
		Pattern.compile(".*\\.(js|css|png|jpe?g|gif|svg|ico|map|woff2?|ttf)(\\?.*)?$", Pattern.CASE_INSENSITIVE);

	private final Settings settings;
	private final Set<String> announcedModules = ConcurrentHashMap.newKeySet();

	public NoiseFilter() {
		this(Settings.defaults(RuntimeMode.DEVELOPMENT));
	}

	public NoiseFilter(Settings settings) {
		this.settings = settings;
	}

	public boolean dropLog(LogLevel level, String category, String message, Map<String, ?> context) {
		final String cat = category == null ? "" : category.toLowerCase(Locale.ROOT);
		final String msg = message == null ? "" : message;
		final boolean production = settings.runtimeMode() == RuntimeMode.PRODUCTION;

		if (production && level == LogLevel.DEBUG) return true;
		if (production && level == LogLevel.INFO && settings.quietCategories().contains(cat)) return true;

		if (settings.requestCategories().contains(cat) && isStaticAssetRequest(msg, context)) return true;

		if (level == LogLevel.ERROR && ("calendar".equals(cat) || "graph".equals(cat))) {
			for (String pattern : settings.suppressedErrorPatterns()) {
				if (msg.contains(pattern)) return true;
			}
		}

		if (msg.startsWith(MODULE_REGISTERED)) {
			Object moduleId = context == null ? null : context.get("moduleId");
			if (moduleId != null && !announcedModules.add(String.valueOf(moduleId))) return true;
		}
		return false;
	}

	public boolean dropMetric(String name, double value) {
		if (name == null) return false;
		if (name.startsWith("storage_")) return true;
		for (String suffix : settings.performanceSuffixes()) {
			if (name.endsWith(suffix)) return value < settings.performanceFloorMillis();
		}
		return false;
	}

	/** Forgets announced modules so a fresh registration round is logged again. */
	public void reset() {
		announcedModules.clear();
	}

	public RuntimeMode runtimeMode() {
		return settings.runtimeMode();
	}

	private static boolean isStaticAssetRequest(String message, Map<String, ?> context) {
		if (context != null) {
			for (String key : List.of("path", "url")) {
				Object v = context.get(key);
				if (v instanceof String s && STATIC_ASSET.matcher(s).matches()) return true;
			}
		}
		for (String token : message.split("\\s+")) {
			if (token.startsWith("/") && STATIC_ASSET.matcher(token).matches()) return true;
		}
		return false;
	}

	/** Rules for {@link NoiseFilter}. Category names are lowercase. */
	public record Settings(
		RuntimeMode runtimeMode,
		Set<String> quietCategories,
		Set<String> requestCategories,
		List<String> suppressedErrorPatterns,
		List<String> performanceSuffixes,
		double performanceFloorMillis) {

		public Settings {
			runtimeMode = runtimeMode == null ? RuntimeMode.DEVELOPMENT : runtimeMode;
			quietCategories = Set.copyOf(quietCategories);
			requestCategories = Set.copyOf(requestCategories);
			suppressedErrorPatterns = List.copyOf(suppressedErrorPatterns);
			performanceSuffixes = List.copyOf(performanceSuffixes);
		}

		public static Settings defaults(RuntimeMode mode) {
			return new Settings(
				mode,
				Set.of("api", "calendar", "graph"),
				Set.of("api", "http", "routes"),
				List.of("Graph API request failed", "Unable to read error response"),
				List.of("_success", "_duration", "_time", "_ms"),
				10.0);
		}
	}
}
