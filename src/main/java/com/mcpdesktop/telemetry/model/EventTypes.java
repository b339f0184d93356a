package com.mcpdesktop.telemetry.model;

/** Well-known bus event names shared by producers, the pipeline and live consumers. */
public final class EventTypes {

	public static final String LOG_ERROR = "log:error";
	public static final String LOG_WARN = "log:warn";
	public static final String LOG_INFO = "log:info";
	public static final String LOG_DEBUG = "log:debug";
	public static final String LOG_METRIC = "log:metric";

	public static final String ERROR_CREATED = "error:created";

	/** Records offered to the pipeline by other components; only the gated survivors reach the log events. */
	public static final String LOG_INGEST = "log:ingest";

	public static final String SYSTEM_MEMORY_WARNING = "system:memory:warning";
	public static final String SYSTEM_EMERGENCY = "system:emergency";

	/** All log-level events in ascending severity. */
	public static final String[] LOG_EVENTS = {LOG_DEBUG, LOG_INFO, LOG_WARN, LOG_ERROR};

	private EventTypes() {}
}
