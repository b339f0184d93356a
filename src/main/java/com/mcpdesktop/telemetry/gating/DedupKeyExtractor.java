package com.mcpdesktop.telemetry.gating;

import com.mcpdesktop.telemetry.model.TelemetryRecord;

/**
 * Category-specific dedup hashing. Returning null means "not applicable", and the filter falls back to its default
 * key of category, level, truncated message and whitelisted context fields.
 */
@FunctionalInterface
public interface DedupKeyExtractor {

	String keyFor(TelemetryRecord record);
}
