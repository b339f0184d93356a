package com.mcpdesktop.telemetry.errors;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;
import com.mcpdesktop.telemetry.model.LogLevel;

public enum Severity {
	INFO(LogLevel.INFO),
	WARNING(LogLevel.WARN),
	ERROR(LogLevel.ERROR),
	CRITICAL(LogLevel.ERROR);

	private final LogLevel logLevel;

	Severity(LogLevel logLevel) {
		this.logLevel = logLevel;
	}

	/** Level of the log record an error of this severity becomes. */
	public LogLevel logLevel() {
		return logLevel;
	}

	@JsonValue
	public String value() {
		return name().toLowerCase(Locale.ROOT);
	}
}
