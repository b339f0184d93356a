package com.mcpdesktop.telemetry.dispatch;

import java.util.function.Predicate;

/**
 * Optional subscription settings.
 *
 * <ul>
 *   <li>{@code filter}: payloads for which it returns false are skipped (not a failure)
 *   <li>{@code once}: the subscription is delivered at most one payload and then removed
 *   <li>{@code userId}/{@code deviceId}: scope; an emit carrying a different non-null value is not delivered
 * </ul>
 */
public record SubscribeOptions(Predicate<Object> filter, boolean once, String userId, String deviceId) {

	private static final SubscribeOptions NONE = new SubscribeOptions(null, false, null, null);

	public static SubscribeOptions none() {
		return NONE;
	}

	public static SubscribeOptions onceOnly() {
		return new SubscribeOptions(null, true, null, null);
	}

	public static SubscribeOptions scoped(String userId, String deviceId) {
		return new SubscribeOptions(null, false, userId, deviceId);
	}

	public static SubscribeOptions filtered(Predicate<Object> filter) {
		return new SubscribeOptions(filter, false, null, null);
	}
}
