package com.mcpdesktop.telemetry.dispatch;

/** Rejected bus call: blank event name or missing handler. Raised before any state is touched. */
public class ValidationException extends IllegalArgumentException {

	public ValidationException(String message) {
		super(message);
	}
}
