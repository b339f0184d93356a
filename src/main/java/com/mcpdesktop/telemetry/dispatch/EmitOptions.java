package com.mcpdesktop.telemetry.dispatch;

/** Scope of a single emit. Null fields match every listener. */
public record EmitOptions(String userId, String deviceId) {

	public static final EmitOptions NONE = new EmitOptions(null, null);

	public static EmitOptions forUser(String userId) {
		return new EmitOptions(userId, null);
	}
}
