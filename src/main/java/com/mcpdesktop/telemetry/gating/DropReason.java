package com.mcpdesktop.telemetry.gating;

/** Why the pipeline silently discarded a call. Never surfaced to producers; only counted. */
public enum DropReason {
	EMERGENCY,
	THROTTLED,
	FILTERED,
	DUPLICATE
}
