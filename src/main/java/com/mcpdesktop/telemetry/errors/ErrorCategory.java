package com.mcpdesktop.telemetry.errors;

import java.util.Locale;

/** Coarse origin of a created error. Records carry the lowercase {@link #value()}. */
public enum ErrorCategory {
	AUTH,
	GRAPH,
	API,
	DATABASE,
	MODULE,
	NLU,
	SYSTEM;

	public String value() {
		return name().toLowerCase(Locale.ROOT);
	}
}
