package com.mcpdesktop.telemetry.receivers;

/** A user log could not be written. The pipeline logs it locally and carries on. */
public class PersistenceException extends Exception {

	public PersistenceException(String message) {
		super(message);
	}

	public PersistenceException(String message, Throwable cause) {
		super(message, cause);
	}
}
