package com.mcpdesktop.telemetry.receivers;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.mcpdesktop.telemetry.model.MetricRecord;
import com.mcpdesktop.telemetry.model.TelemetryRecord;

/**
 * Default transport: hands records to the logging backend under the {@value #LOGGER_NAME} logger, where appenders
 * make them durable.
 *
 * <ul>
 *   <li>record level: compact line with category, message and correlation ids
 *   <li>DEBUG: JSON payload of the whole record
 * </ul>
 */
public class Slf4jLogTransport implements LogTransport {

	public static final String LOGGER_NAME = "mcp.telemetry";

	private static final Logger log = LoggerFactory.getLogger(LOGGER_NAME);

	private final ObjectMapper mapper;

	public Slf4jLogTransport(ObjectMapper mapper) {
		// Reuse the application's mapper when available so JSON matches the rest of the host's output
		ObjectMapper base = (mapper != null) ? mapper.copy() : new ObjectMapper().findAndRegisterModules();
		this.mapper = base.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
	}

	@Override
	public void write(TelemetryRecord r) {
		if (r == null) return;
		final String fmt = "[{}] {} traceId={} userId={} deviceId={}";
		final Object[] args = {
			safe(r.category()), r.message(), safe(r.traceId()), safe(r.userId()), safe(r.deviceId())
		};
		switch (r.level()) {
			case ERROR -> log.error(fmt, args);
			case WARN -> log.warn(fmt, args);
			case INFO -> log.info(fmt, args);
			case DEBUG -> log.debug(fmt, args);
		}
		if (log.isDebugEnabled()) {
			log.debug("record payload: {}", toJson(r));
		}
	}

	@Override
	public void writeMetric(MetricRecord m) {
		if (m == null) return;
		log.info("metric name={} value={} userId={}", m.name(), m.value(), safe(m.userId()));
		if (log.isDebugEnabled()) {
			log.debug("metric payload: {}", toJson(m));
		}
	}

	String toJson(Object value) {
		try {
			return mapper.writeValueAsString(value);
		} catch (JsonProcessingException e) {
			return String.valueOf(value);
		}
	}

	private static Object safe(Object o) {
		return (o == null || "".equals(o)) ? "-" : o;
	}
}
