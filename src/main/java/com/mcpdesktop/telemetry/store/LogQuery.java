package com.mcpdesktop.telemetry.store;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import com.mcpdesktop.telemetry.model.TelemetryEntry;
import com.mcpdesktop.telemetry.model.TelemetryRecord;

/**
 * Ad-hoc filter over buffered log records.
 *
 * <ul>
 *   <li>{@code category}: null or "all" matches everything; "system" also matches records without a category
 *   <li>{@code level}: matches the record level or its severity label
 *   <li>{@code userId}: exact match
 *   <li>{@code limit}: applied after sorting newest first; 0 or less means no limit
 * </ul>
 */
public record LogQuery(String category, String level, String userId, int limit) {

	public static final String ALL = "all";
	public static final String SYSTEM = "system";

	public static LogQuery all() {
		return new LogQuery(null, null, null, 0);
	}

	public static LogQuery latest(int limit) {
		return new LogQuery(null, null, null, limit);
	}

	public LogQuery withCategory(String newCategory) {
		return new LogQuery(newCategory, level, userId, limit);
	}

	public LogQuery withLevel(String newLevel) {
		return new LogQuery(category, newLevel, userId, limit);
	}

	public LogQuery withUserId(String newUserId) {
		return new LogQuery(category, level, newUserId, limit);
	}

	public LogQuery withLimit(int newLimit) {
		return new LogQuery(category, level, userId, newLimit);
	}

	public boolean matches(TelemetryRecord r) {
		if (!matchesCategory(r.category())) return false;
		if (level != null && !ALL.equalsIgnoreCase(level)) {
			String wanted = level.toLowerCase(Locale.ROOT);
			boolean levelHit = r.level().label().equals(wanted);
			boolean severityHit = r.severity() != null && r.severity().toLowerCase(Locale.ROOT).equals(wanted);
			if (!levelHit && !severityHit) return false;
		}
		return userId == null || Objects.equals(userId, r.userId());
	}

	/** Selects the log records among {@code entries} (metrics are ignored), newest first. */
	public List<TelemetryRecord> apply(List<? extends TelemetryEntry> entries) {
		List<TelemetryEntry> newestFirst = new ArrayList<>(entries);
		Collections.reverse(newestFirst); // ties on timestamp keep insertion order, newest first
		Stream<TelemetryRecord> stream = newestFirst.stream()
			.filter(TelemetryRecord.class::isInstance)
			.map(TelemetryRecord.class::cast)
			.filter(this::matches)
			.sorted(Comparator.comparing(TelemetryRecord::timestamp).reversed());
		if (limit > 0) stream = stream.limit(limit);
		return stream.collect(Collectors.toList());
	}

	private boolean matchesCategory(String recordCategory) {
		if (category == null || ALL.equalsIgnoreCase(category)) return true;
		if (SYSTEM.equalsIgnoreCase(category) && (recordCategory == null || recordCategory.isBlank())) return true;
		return category.equalsIgnoreCase(recordCategory);
	}
}
