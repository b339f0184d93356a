package com.mcpdesktop.telemetry.dispatch;

/** Cumulative counters since the bus was created. */
public record BusStatistics(long emits, long delivered, long failed, long filtered, long scopeFiltered) {}
