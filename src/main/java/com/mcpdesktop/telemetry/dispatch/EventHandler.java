package com.mcpdesktop.telemetry.dispatch;

/** Callback attached to a bus subscription. Any exception is isolated by the bus and reported as a handler failure. */
@FunctionalInterface
public interface EventHandler {

	void handle(Object payload) throws Exception;
}
