package com.mcpdesktop.telemetry.dispatch;

/** Outcome of one emit, folded into {@link BusStatistics} and logged at debug. */
public record DispatchStats(
	String eventName, int listeners, int delivered, int failed, int filtered, int scopeFiltered, long elapsedNanos) {

	public double elapsedMillis() {
		return elapsedNanos / 1_000_000.0;
	}
}
