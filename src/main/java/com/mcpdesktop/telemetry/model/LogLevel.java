package com.mcpdesktop.telemetry.model;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

/** Severity ladder for log records; the lowercase form is what travels on the bus and in JSON. */
public enum LogLevel {
	DEBUG("log:debug"),
	INFO("log:info"),
	WARN("log:warn"),
	ERROR("log:error");

	private final String eventName;

	LogLevel(String eventName) {
		this.eventName = eventName;
	}

	/** Bus event on which records of this level are broadcast. */
	public String eventName() {
		return eventName;
	}

	@JsonValue
	public String label() {
		return name().toLowerCase(Locale.ROOT);
	}
}
