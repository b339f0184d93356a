package com.mcpdesktop.telemetry.dispatch;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Predicate;

/** A registered listener. Owned by the {@link EventBus}; callers only ever see its id. */
public final class Subscription {

	private final long id;
	private final String eventName;
	private final EventHandler handler;
	private final boolean once;
	private final Predicate<Object> filter;
	private final String userId;
	private final String deviceId;
	private final AtomicBoolean consumed = new AtomicBoolean(false);

	Subscription(long id, String eventName, EventHandler handler, SubscribeOptions options) {
		this.id = id;
		this.eventName = Objects.requireNonNull(eventName);
		this.handler = Objects.requireNonNull(handler);
		this.once = options.once();
		this.filter = options.filter();
		this.userId = options.userId();
		this.deviceId = options.deviceId();
	}

	public long id() {
		return id;
	}

	public String eventName() {
		return eventName;
	}

	public boolean once() {
		return once;
	}

	public String userId() {
		return userId;
	}

	public String deviceId() {
		return deviceId;
	}

	EventHandler handler() {
		return handler;
	}

	/** Skipped only when both sides carry a value for the same field and the values differ. */
	boolean inScope(EmitOptions emit) {
		if (userId != null && emit.userId() != null && !userId.equals(emit.userId())) return false;
		return deviceId == null || emit.deviceId() == null || deviceId.equals(emit.deviceId());
	}

	boolean accepts(Object payload) {
		return filter == null || filter.test(payload);
	}

	/** Claims the single delivery of a once-subscription; only the first caller wins. */
	boolean claim() {
		return consumed.compareAndSet(false, true);
	}

	@Override
	public String toString() {
		return "Subscription{id=" + id + ", event='" + eventName + "', once=" + once + "}";
	}
}
