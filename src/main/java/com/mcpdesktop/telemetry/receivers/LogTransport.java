package com.mcpdesktop.telemetry.receivers;

import com.mcpdesktop.telemetry.model.MetricRecord;
import com.mcpdesktop.telemetry.model.TelemetryRecord;

/**
 * Durable destination for records that survived gating. Implementations must not throw for ordinary write
 * problems; the pipeline logs and ignores anything that escapes.
 */
public interface LogTransport {

	default void write(TelemetryRecord record) {
	}

	default void writeMetric(MetricRecord metric) {
	}
}
