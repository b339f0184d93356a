package com.mcpdesktop.telemetry.aspect;

import com.mcpdesktop.telemetry.annotations.Monitored;

/**
 * What the aspect knows about the intercepted operation.
 *
 * <ul>
 *   <li>{@code component}/{@code name}: from {@code @Monitored} (method over type), name defaulting to the class
 *   <li>{@code requestIdIndex}: position of the {@code @RequestId} argument, or -1
 * </ul>
 */
public record OperationOptions(
	Monitored.Component component, String name, String method, boolean logParams, int requestIdIndex) {

	/** "Module calendar.findEvents" */
	public String label() {
		return component.label() + " " + name + "." + method;
	}

	public String category() {
		return component.category();
	}
}
