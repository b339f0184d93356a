package com.mcpdesktop.telemetry.receivers;

import java.time.Instant;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.mcpdesktop.telemetry.model.LogLevel;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record UserLogEntry(
	long id,
	String userId,
	LogLevel level,
	String message,
	String category,
	Map<String, Object> context,
	String traceId,
	String deviceId,
	Instant timestamp) {}
