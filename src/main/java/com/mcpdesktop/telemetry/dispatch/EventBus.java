package com.mcpdesktop.telemetry.dispatch;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-process publish/subscribe bus.
 *
 * <p>Delivery is synchronous and sequential on the emitting thread, in subscription order. Each emit iterates a
 * snapshot of the listeners, so subscribing or unsubscribing from inside a handler only affects later emits. A
 * throwing handler never stops delivery to the others: it is counted and reported once to the failure reporter.
 *
 * <p>The bus knows nothing about telemetry. The sink installs itself as failure reporter during its start phase; until
 * then failures go to SLF4J only.
 */
public class EventBus {

	private static final Logger log = LoggerFactory.getLogger(EventBus.class);

	private final AtomicLong nextId = new AtomicLong(1);
	private final ConcurrentMap<String, CopyOnWriteArrayList<Subscription>> listeners = new ConcurrentHashMap<>();
	private final ConcurrentMap<Long, Subscription> byId = new ConcurrentHashMap<>();

	private final LongAdder emits = new LongAdder();
	private final LongAdder delivered = new LongAdder();
	private final LongAdder failed = new LongAdder();
	private final LongAdder filtered = new LongAdder();
	private final LongAdder scopeFiltered = new LongAdder();

	private volatile Consumer<HandlerFailure> failureReporter;

	// === Subscriptions ===

	public long subscribe(String eventName, EventHandler handler) {
		return subscribe(eventName, handler, SubscribeOptions.none());
	}

	public long subscribe(String eventName, EventHandler handler, SubscribeOptions options) {
		requireEventName(eventName);
		if (handler == null) {
			throw new ValidationException("Handler for event '" + eventName + "' must not be null");
		}
		final SubscribeOptions opts = options == null ? SubscribeOptions.none() : options;
		final long id = nextId.getAndIncrement();
		final Subscription sub = new Subscription(id, eventName, handler, opts);

		listeners.compute(eventName, (k, list) -> {
			CopyOnWriteArrayList<Subscription> l = (list == null) ? new CopyOnWriteArrayList<>() : list;
			l.add(sub);
			return l;
		});
		byId.put(id, sub);

		log.debug(
			"BUS: subscribed id={} event='{}' once={} userId={} deviceId={}",
			id, eventName, opts.once(), opts.userId(), opts.deviceId());
		return id;
	}

	/** Returns false for an unknown (or already removed) id. */
	public boolean unsubscribe(long id) {
		final Subscription sub = byId.remove(id);
		if (sub == null) {
			log.debug("BUS: unsubscribe ignored for unknown id={}", id);
			return false;
		}
		listeners.computeIfPresent(sub.eventName(), (k, list) -> {
			list.remove(sub);
			return list.isEmpty() ? null : list;
		});
		log.debug("BUS: unsubscribed id={} event='{}'", id, sub.eventName());
		return true;
	}

	public void clear() {
		int count = byId.size();
		listeners.clear();
		byId.clear();
		log.debug("BUS: cleared {} subscription(s)", count);
	}

	public int listenerCount() {
		return byId.size();
	}

	public int listenerCount(String eventName) {
		List<Subscription> list = (eventName == null) ? null : listeners.get(eventName);
		return list == null ? 0 : list.size();
	}

	// === Emission ===

	public void emit(String eventName, Object payload) {
		emit(eventName, payload, EmitOptions.NONE);
	}

	public void emit(String eventName, Object payload, EmitOptions options) {
		requireEventName(eventName);
		final EmitOptions opts = options == null ? EmitOptions.NONE : options;
		emits.increment();

		final List<Subscription> current = listeners.get(eventName);
		if (current == null || current.isEmpty()) {
			log.trace("BUS: no listeners for event '{}'", eventName);
			return;
		}

		final long start = System.nanoTime();
		int total = 0;
		int ok = 0;
		int bad = 0;
		int skipped = 0;
		int outOfScope = 0;

		// CopyOnWriteArrayList iterators are snapshots
		for (Subscription sub : current) {
			total++;
			if (!sub.inScope(opts)) {
				outOfScope++;
				continue;
			}
			if (!passesFilter(sub, payload)) {
				skipped++;
				continue;
			}
			if (sub.once() && !sub.claim()) {
				continue;
			}
			try {
				sub.handler().handle(payload);
				ok++;
			} catch (Exception ex) {
				bad++;
				reportFailure(eventName, sub, ex);
			} finally {
				if (sub.once()) unsubscribe(sub.id());
			}
		}

		final DispatchStats stats =
			new DispatchStats(eventName, total, ok, bad, skipped, outOfScope, System.nanoTime() - start);
		delivered.add(ok);
		failed.add(bad);
		filtered.add(skipped);
		scopeFiltered.add(outOfScope);

		if (log.isDebugEnabled()) {
			log.debug(
				"BUS: emit event='{}' listeners={} delivered={} failed={} filtered={} scopeFiltered={} took={}ms",
				eventName,
				stats.listeners(),
				stats.delivered(),
				stats.failed(),
				stats.filtered(),
				stats.scopeFiltered(),
				String.format("%.3f", stats.elapsedMillis()));
		}
	}

	// === Failure reporting ===

	/** Installs the consumer that turns handler failures into telemetry. Pass null to fall back to logging only. */
	public void setFailureReporter(Consumer<HandlerFailure> reporter) {
		this.failureReporter = reporter;
	}

	public BusStatistics statistics() {
		return new BusStatistics(emits.sum(), delivered.sum(), failed.sum(), filtered.sum(), scopeFiltered.sum());
	}

	private boolean passesFilter(Subscription sub, Object payload) {
		try {
			return sub.accepts(payload);
		} catch (RuntimeException ex) {
			log.warn("BUS: filter of subscription id={} threw for event '{}'; skipping", sub.id(), sub.eventName(), ex);
			return false;
		}
	}

	private void reportFailure(String eventName, Subscription sub, Exception ex) {
		final HandlerFailure failure = new HandlerFailure(eventName, sub.id(), sub.userId(), sub.deviceId(), ex);
		final Consumer<HandlerFailure> reporter = this.failureReporter;
		if (reporter == null) {
			log.error("Event handler failed for event '{}' (listenerId={})", eventName, sub.id(), ex);
			return;
		}
		try {
			reporter.accept(failure);
		} catch (RuntimeException reportEx) {
			log.error(
				"Failed to report handler failure for event '{}' (listenerId={}); original error: {}",
				eventName, sub.id(), failure.errorMessage(), reportEx);
		}
	}

	private static void requireEventName(String eventName) {
		if (eventName == null || eventName.isBlank()) {
			throw new ValidationException("Event name must be a non-empty string");
		}
	}
}
