package com.mcpdesktop.telemetry.gating;

import java.time.Duration;

/**
 * Result of {@link ThrottleGuard#shouldAccept(String)}. When the call closed a window in which records were
 * suppressed, {@link #summary()} describes that window so it can be reported once.
 */
public record ThrottleDecision(boolean accepted, Summary summary) {

	static final ThrottleDecision ACCEPT = new ThrottleDecision(true, null);
	static final ThrottleDecision SUPPRESS = new ThrottleDecision(false, null);

	public boolean hasSummary() {
		return summary != null;
	}

	/** Suppressions accumulated by a category during one closed window. */
	public record Summary(String category, int suppressed, Duration window) {

		public String message() {
			return "Suppressed " + suppressed + " similar errors in category '" + category + "' in the last "
				+ window.toMillis() + "ms";
		}
	}
}
