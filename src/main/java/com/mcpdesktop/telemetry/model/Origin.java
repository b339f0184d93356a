package com.mcpdesktop.telemetry.model;

/**
 * Correlation identifiers a producer may attach to a telemetry call. Every field is optional; {@link #NONE} carries
 * nothing.
 */
public record Origin(String traceId, String userId, String deviceId) {

	public static final Origin NONE = new Origin(null, null, null);

	public static Origin trace(String traceId) {
		return new Origin(traceId, null, null);
	}

	public static Origin user(String userId) {
		return new Origin(null, userId, null);
	}

	public static Origin user(String userId, String deviceId) {
		return new Origin(null, userId, deviceId);
	}

	public Origin withTraceId(String newTraceId) {
		return new Origin(newTraceId, userId, deviceId);
	}
}
