package com.mcpdesktop.telemetry.dispatch;

/** A listener threw while handling {@code eventName}; delivery to the remaining listeners went on. */
public record HandlerFailure(String eventName, long subscriptionId, String userId, String deviceId, Throwable error) {

	public String errorMessage() {
		String msg = error == null ? null : error.getMessage();
		return msg == null ? (error == null ? "unknown" : error.getClass().getSimpleName()) : msg;
	}
}
