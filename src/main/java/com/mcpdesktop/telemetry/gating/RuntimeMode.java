package com.mcpdesktop.telemetry.gating;

/** Deployment flavour; production drops debug output and routine request chatter. */
public enum RuntimeMode {
	DEVELOPMENT,
	PRODUCTION
}
