package com.mcpdesktop.telemetry.processor;

/** Removes every bus subscription made by one {@code subscribeTo...} call. Idempotent. */
@FunctionalInterface
public interface Unsubscriber extends AutoCloseable {

	void unsubscribe();

	@Override
	default void close() {
		unsubscribe();
	}
}
