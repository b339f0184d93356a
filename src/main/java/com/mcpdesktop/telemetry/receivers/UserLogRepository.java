package com.mcpdesktop.telemetry.receivers;

import java.util.Map;

import com.mcpdesktop.telemetry.model.LogLevel;

/** Per-user log storage owned by the host application. Called off the producer's thread. */
public interface UserLogRepository {

	void persistUserLog(
		String userId,
		LogLevel level,
		String message,
		String category,
		Map<String, Object> context,
		String traceId,
		String deviceId)
		throws PersistenceException;
}
