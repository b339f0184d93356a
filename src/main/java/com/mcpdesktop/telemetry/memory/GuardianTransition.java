package com.mcpdesktop.telemetry.memory;

import java.time.Instant;

/** Emergency mode was entered ({@code active=true}) or left, at the given heap utilization. */
public record GuardianTransition(boolean active, double ratio, double threshold, Instant at) {

	public String message() {
		return active
			? String.format(
				"Memory emergency: heap at %.1f%% exceeds %.1f%%; dropping telemetry", ratio * 100, threshold * 100)
			: String.format(
				"Memory emergency cleared: heap at %.1f%% below %.1f%%", ratio * 100, threshold * 100);
	}
}
