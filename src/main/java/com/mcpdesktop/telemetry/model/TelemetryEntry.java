package com.mcpdesktop.telemetry.model;

import java.time.Instant;
import java.util.Map;

/** Common shape of everything the ring buffer holds: log records and metric samples. */
public interface TelemetryEntry {

	String id();

	Instant timestamp();

	Map<String, Object> context();

	String userId();

	String deviceId();
}
