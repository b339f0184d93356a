package com.mcpdesktop.telemetry.memory;

import java.time.Instant;

/** Heap utilization crossed the warning threshold. Advisory only; telemetry keeps flowing. */
public record MemoryWarning(double ratio, double threshold, boolean gcRequested, Instant at) {

	public String message() {
		return String.format(
			"High memory usage: heap at %.1f%% (warning threshold %.1f%%)", ratio * 100, threshold * 100);
	}
}
