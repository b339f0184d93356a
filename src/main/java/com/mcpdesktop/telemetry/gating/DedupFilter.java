package com.mcpdesktop.telemetry.gating;

import java.time.Clock;
import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mcpdesktop.telemetry.model.LogLevel;
import com.mcpdesktop.telemetry.model.TelemetryRecord;

/**
 * Content-addressed suppressor of near-duplicate log records.
 *
 * <p>A record is a duplicate when its hash was recorded less than its window ago. Duplicates do not refresh the
 * stored timestamp, so a steady stream of identical records is let through once per window. Hashes come from a
 * per-category {@link DedupKeyExtractor} when one is registered and applies, otherwise from the default key. The
 * {@link ApiFailureKeyExtractor} is registered for "graph" and "calendar" out of the box.
 *
 * <p>Window selection:
 *
 * <ul>
 *   <li>a configured category window, when the category has one
 *   <li>{@code errorWindow} for error and warn records
 *   <li>{@code defaultWindow} for info and debug records
 * </ul>
 *
 * <p>The store is capped at {@code maxEntries}; on overflow only the most recently seen third is kept. Expired
 * entries are swept lazily on a random fraction of calls and by {@link #sweep()}.
 */
public class DedupFilter {

	private static final Logger log = LoggerFactory.getLogger(DedupFilter.class);

	static final int MESSAGE_PREFIX = 100;

	private final Settings settings;
	private final Clock clock;
	private final DoubleSupplier random;
	private final ObjectMapper mapper = new ObjectMapper();
	private final Map<String, DedupKeyExtractor> extractors = new ConcurrentHashMap<>();

	/** Insertion order equals last-recorded order; entries are re-inserted when recorded again. */
	private final LinkedHashMap<String, Entry> entries = new LinkedHashMap<>();

	public DedupFilter() {
		this(Settings.defaults(), Clock.systemUTC(), () -> ThreadLocalRandom.current().nextDouble());
	}

	public DedupFilter(Settings settings, Clock clock, DoubleSupplier random) {
		this.settings = settings;
		this.clock = clock;
		this.random = random;
		ApiFailureKeyExtractor apiFailures = new ApiFailureKeyExtractor();
		registerExtractor("graph", apiFailures);
		registerExtractor("calendar", apiFailures);
	}

	/** Registers a hashing strategy for one category (case-insensitive). Replaces any previous one. */
	public void registerExtractor(String category, DedupKeyExtractor extractor) {
		extractors.put(category.toLowerCase(Locale.ROOT), extractor);
	}

	public synchronized boolean isDuplicate(TelemetryRecord record) {
		final long now = clock.millis();
		if (random.getAsDouble() < settings.sweepProbability()) {
			sweepExpired(now);
		}

		final String hash = keyFor(record);
		final Entry seen = entries.get(hash);
		if (seen != null && now - seen.lastSeen < seen.windowMillis) {
			log.trace("Dedup hit hash='{}'", hash);
			return true;
		}

		entries.remove(hash);
		entries.put(hash, new Entry(now, windowFor(record).toMillis()));
		if (entries.size() > settings.maxEntries()) {
			trim();
		}
		return false;
	}

	/** Removes expired entries; returns how many were dropped. */
	public synchronized int sweep() {
		return sweepExpired(clock.millis());
	}

	public synchronized int size() {
		return entries.size();
	}

	public synchronized void clearAll() {
		entries.clear();
	}

	// === Hashing ===

	String keyFor(TelemetryRecord record) {
		DedupKeyExtractor extractor = extractors.get(record.category().toLowerCase(Locale.ROOT));
		if (extractor != null) {
			try {
				String key = extractor.keyFor(record);
				if (key != null) return key;
			} catch (RuntimeException ex) {
				log.warn("Dedup extractor for category '{}' failed; using default key", record.category(), ex);
			}
		}
		return defaultKey(record);
	}

	String defaultKey(TelemetryRecord record) {
		String message = record.message();
		if (message.length() > MESSAGE_PREFIX) message = message.substring(0, MESSAGE_PREFIX);
		StringBuilder key = new StringBuilder()
			.append(record.category()).append(':')
			.append(record.level().label()).append(':')
			.append(message);

		Map<String, Object> relevant = new TreeMap<>();
		for (String field : settings.contextFields()) {
			Object v = record.context().get(field);
			if (v instanceof String || v instanceof Number) relevant.put(field, v);
		}
		if (!relevant.isEmpty()) {
			key.append(':').append(toJson(relevant));
		}
		return key.toString();
	}

	Duration windowFor(TelemetryRecord record) {
		Duration byCategory = settings.categoryWindows().get(record.category().toLowerCase(Locale.ROOT));
		if (byCategory != null) return byCategory;
		return (record.level() == LogLevel.ERROR || record.level() == LogLevel.WARN)
			? settings.errorWindow()
			: settings.defaultWindow();
	}

	private String toJson(Map<String, Object> fields) {
		try {
			return mapper.writeValueAsString(fields);
		} catch (JsonProcessingException ex) {
			log.debug("Dedup context serialization failed; using toString()", ex);
			return fields.toString();
		}
	}

	// === Eviction ===

	private int sweepExpired(long now) {
		int removed = 0;
		for (Iterator<Entry> it = entries.values().iterator(); it.hasNext(); ) {
			Entry e = it.next();
			if (now - e.lastSeen >= e.windowMillis) {
				it.remove();
				removed++;
			}
		}
		if (removed > 0) log.debug("Dedup sweep removed {} expired entr(ies), {} left", removed, entries.size());
		return removed;
	}

	private void trim() {
		final int keep = Math.max(1, settings.maxEntries() / 3);
		int toDrop = entries.size() - keep;
		for (Iterator<String> it = entries.keySet().iterator(); it.hasNext() && toDrop > 0; toDrop--) {
			it.next();
			it.remove();
		}
		log.debug("Dedup store exceeded {} entries; trimmed to the newest {}", settings.maxEntries(), keep);
	}

	private static final class Entry {
		final long lastSeen;
		final long windowMillis;

		Entry(long lastSeen, long windowMillis) {
			this.lastSeen = lastSeen;
			this.windowMillis = windowMillis;
		}
	}

	/**
	 * Tuning for the filter. Category windows are keyed by lowercase category name.
	 */
	public record Settings(
		Duration defaultWindow,
		Duration errorWindow,
		Map<String, Duration> categoryWindows,
		int maxEntries,
		double sweepProbability,
		List<String> contextFields) {

		public static final Duration DEFAULT_WINDOW = Duration.ofSeconds(30);
		public static final Duration DEFAULT_ERROR_WINDOW = Duration.ofSeconds(45);
		public static final int DEFAULT_MAX_ENTRIES = 500;
		public static final double DEFAULT_SWEEP_PROBABILITY = 0.1;
		public static final List<String> DEFAULT_CONTEXT_FIELDS =
			List.of("statusCode", "errorCode", "requestId", "method", "path");

		public Settings {
			if (defaultWindow == null || errorWindow == null) {
				throw new IllegalArgumentException("dedup windows must be set");
			}
			if (maxEntries < 3) {
				throw new IllegalArgumentException("dedup maxEntries must be >= 3 (was " + maxEntries + ")");
			}
			if (sweepProbability < 0 || sweepProbability > 1) {
				throw new IllegalArgumentException("dedup sweepProbability must be within [0,1]");
			}
			Map<String, Duration> normalized = new LinkedHashMap<>();
			if (categoryWindows != null) {
				categoryWindows.forEach((k, v) -> normalized.put(k.toLowerCase(Locale.ROOT), v));
			}
			categoryWindows = Map.copyOf(normalized);
			contextFields = contextFields == null ? DEFAULT_CONTEXT_FIELDS : List.copyOf(contextFields);
		}

		public static Settings defaults() {
			return new Settings(
				DEFAULT_WINDOW,
				DEFAULT_ERROR_WINDOW,
				defaultCategoryWindows(),
				DEFAULT_MAX_ENTRIES,
				DEFAULT_SWEEP_PROBABILITY,
				DEFAULT_CONTEXT_FIELDS);
		}

		public static Map<String, Duration> defaultCategoryWindows() {
			return Map.of(
				"calendar", Duration.ofSeconds(60),
				"graph", Duration.ofSeconds(60),
				"api", Duration.ofSeconds(45));
		}
	}
}
