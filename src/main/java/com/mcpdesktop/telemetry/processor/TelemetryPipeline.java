package com.mcpdesktop.telemetry.processor;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mcpdesktop.telemetry.dispatch.EmitOptions;
import com.mcpdesktop.telemetry.dispatch.EventBus;
import com.mcpdesktop.telemetry.dispatch.HandlerFailure;
import com.mcpdesktop.telemetry.dispatch.SubscribeOptions;
import com.mcpdesktop.telemetry.dispatch.ValidationException;
import com.mcpdesktop.telemetry.errors.ErrorCategory;
import com.mcpdesktop.telemetry.errors.TelemetryError;
import com.mcpdesktop.telemetry.gating.DedupFilter;
import com.mcpdesktop.telemetry.gating.DropReason;
import com.mcpdesktop.telemetry.gating.GatingStatistics;
import com.mcpdesktop.telemetry.gating.NoiseFilter;
import com.mcpdesktop.telemetry.gating.ThrottleDecision;
import com.mcpdesktop.telemetry.gating.ThrottleGuard;
import com.mcpdesktop.telemetry.memory.GuardianTransition;
import com.mcpdesktop.telemetry.memory.MemoryGuardian;
import com.mcpdesktop.telemetry.memory.MemoryWarning;
import com.mcpdesktop.telemetry.model.ContextSanitizer;
import com.mcpdesktop.telemetry.model.EventTypes;
import com.mcpdesktop.telemetry.model.LogLevel;
import com.mcpdesktop.telemetry.model.MetricRecord;
import com.mcpdesktop.telemetry.model.Origin;
import com.mcpdesktop.telemetry.model.TelemetryEntry;
import com.mcpdesktop.telemetry.model.TelemetryRecord;
import com.mcpdesktop.telemetry.receivers.LogTransport;
import com.mcpdesktop.telemetry.receivers.PersistenceException;
import com.mcpdesktop.telemetry.receivers.UserLogRepository;
import com.mcpdesktop.telemetry.store.CircularLogStore;
import com.mcpdesktop.telemetry.store.LogQuery;
import com.mcpdesktop.telemetry.utils.TelemetryIds;

/**
 * The telemetry sink: gates every producer call, keeps the survivors in a ring buffer, hands them to the durable
 * transport and user-log persistence, and re-publishes them on the bus for live subscribers.
 *
 * <p>Gating chain for log calls:
 *
 * <ol>
 *   <li>memory emergency drops everything
 *   <li>error records are throttled per category
 *   <li>noise rules drop routine chatter
 *   <li>the record is built (sanitized context, trace id from the current span when missing)
 *   <li>near-duplicates are dropped
 * </ol>
 *
 * Metrics skip throttling and deduplication.
 *
 * <p>Construction and wiring are separate: the bus, gates and stores are created first, then {@link #start()}
 * registers the pipeline with the bus (handler failure reporting, ingestion of errors published by other components)
 * and the memory guardian, and schedules the periodic sweeps. Other components offer records on {@code log:ingest};
 * the survivors are broadcast on the level events, which the pipeline never listens to. A listener failure that
 * happens while the pipeline is itself broadcasting is stored without being broadcast, so neither path can loop.
 */
public class TelemetryPipeline implements TelemetrySink, AutoCloseable {

	private static final Logger log = LoggerFactory.getLogger(TelemetryPipeline.class);

	public static final Duration DEFAULT_SWEEP_INTERVAL = Duration.ofSeconds(5);

	private final EventBus bus;
	private final ThrottleGuard throttle;
	private final DedupFilter dedup;
	private final NoiseFilter noise;
	private final MemoryGuardian guardian;
	private final CircularLogStore<TelemetryEntry> buffer;
	private final LogTransport transport;
	private final UserLogRepository userLogs;
	private final Executor persistenceExecutor;
	private final boolean ownsPersistenceExecutor;
	private final TraceCorrelation traces;
	private final FallbackTelemetrySink fallback;
	private final Clock clock;
	private final Duration sweepInterval;

	private final GatingStatistics statistics = new GatingStatistics();
	private final ThreadLocal<Boolean> broadcasting = ThreadLocal.withInitial(() -> Boolean.FALSE);

	private long ingestSubscriptionId = -1;
	private ScheduledExecutorService sweeper;
	private volatile boolean started;

	private TelemetryPipeline(Builder b) {
		this.bus = Objects.requireNonNull(b.bus, "bus");
		this.clock = b.clock != null ? b.clock : Clock.systemUTC();
		this.throttle = b.throttle != null ? b.throttle : new ThrottleGuard();
		this.dedup = b.dedup != null ? b.dedup : new DedupFilter();
		this.noise = b.noise != null ? b.noise : new NoiseFilter();
		this.guardian = b.guardian != null ? b.guardian : new MemoryGuardian();
		this.buffer = new CircularLogStore<>(b.bufferCapacity);
		this.transport = b.transport != null ? b.transport : new LogTransport() {};
		this.userLogs = b.userLogs;
		if (b.persistenceExecutor != null) {
			this.persistenceExecutor = b.persistenceExecutor;
			this.ownsPersistenceExecutor = false;
		} else {
			this.persistenceExecutor = Executors.newSingleThreadExecutor(daemon("telemetry-persistence"));
			this.ownsPersistenceExecutor = true;
		}
		this.traces = b.traces != null ? b.traces : new TraceCorrelation();
		this.fallback = b.fallback != null ? b.fallback : new FallbackTelemetrySink();
		this.sweepInterval = b.sweepInterval != null ? b.sweepInterval : DEFAULT_SWEEP_INTERVAL;
	}

	public static Builder builder(EventBus bus) {
		return new Builder(bus);
	}

	// === Lifecycle ===

	public synchronized void start() {
		if (started) return;
		bus.setFailureReporter(this::onHandlerFailure);
		ingestSubscriptionId = bus.subscribe(
			EventTypes.LOG_INGEST,
			payload -> ingestPublished((TelemetryRecord) payload),
			SubscribeOptions.filtered(p -> p instanceof TelemetryRecord r && !r.builtByPipeline()));

		guardian.setTransitionListener(this::onGuardianTransition);
		guardian.setWarningListener(this::onMemoryWarning);
		guardian.start();

		sweeper = Executors.newSingleThreadScheduledExecutor(daemon("telemetry-sweeper"));
		long ms = sweepInterval.toMillis();
		sweeper.scheduleAtFixedRate(this::sweep, ms, ms, TimeUnit.MILLISECONDS);

		started = true;
		log.info(
			"Telemetry pipeline started (buffer={}, throttle={}/{}ms, sweep={}ms, persistence={})",
			buffer.capacity(),
			throttle.threshold(),
			throttle.window().toMillis(),
			ms,
			userLogs != null);
	}

	public boolean isStarted() {
		return started;
	}

	@Override
	public synchronized void close() {
		if (ownsPersistenceExecutor) {
			((ExecutorService) persistenceExecutor).shutdown();
		}
		if (!started) return;
		started = false;
		bus.unsubscribe(ingestSubscriptionId);
		bus.setFailureReporter(null);
		guardian.setTransitionListener(null);
		guardian.setWarningListener(null);
		guardian.close();
		sweeper.shutdownNow();
		sweeper = null;
		log.info("Telemetry pipeline stopped; {}", statistics);
	}

	// === Producer entry points ===

	@Override
	public void debug(String message, Map<String, ?> context, String category, Origin origin) {
		ingestLog(LogLevel.DEBUG, message, context, category, origin);
	}

	@Override
	public void info(String message, Map<String, ?> context, String category, Origin origin) {
		ingestLog(LogLevel.INFO, message, context, category, origin);
	}

	@Override
	public void warn(String message, Map<String, ?> context, String category, Origin origin) {
		ingestLog(LogLevel.WARN, message, context, category, origin);
	}

	@Override
	public void error(String message, Map<String, ?> context, String category, Origin origin) {
		ingestLog(LogLevel.ERROR, message, context, category, origin);
	}

	@Override
	public void logError(TelemetryError error) {
		if (error == null) return;
		try {
			TelemetryRecord r = error.toRecord(TelemetryRecord.PIPELINE_SOURCE);
			if (!passesGates(r.level(), r.category(), r.message(), r.context())) return;
			deliver(withTrace(r), true);
		} catch (RuntimeException ex) {
			fallback.internalFailure("Telemetry ingestion of error id=" + error.id() + " failed", ex);
		}
	}

	@Override
	public void trackMetric(String name, double value, Map<String, ?> context, Origin origin) {
		try {
			if (name == null || name.isBlank()) {
				log.debug("Ignoring metric without a name (value={})", value);
				return;
			}
			if (emergencyDrop()) return;
			if (noise.dropMetric(name, value)) {
				statistics.recordDrop(DropReason.FILTERED);
				return;
			}
			final Origin o = origin == null ? Origin.NONE : origin;
			MetricRecord m = new MetricRecord(
				TelemetryIds.newId(clock),
				name,
				value,
				ContextSanitizer.sanitize(context),
				clock.instant(),
				o.userId(),
				o.deviceId());
			statistics.recordAccepted();
			buffer.add(m);
			writeTransport(m);
			broadcast(EventTypes.LOG_METRIC, m, m.userId(), m.deviceId());
		} catch (RuntimeException ex) {
			fallback.internalFailure("Metric ingestion failed for '" + name + "'", ex);
		}
	}

	// === Live subscriptions and queries ===

	public Unsubscriber subscribeToLogs(Consumer<TelemetryRecord> callback) {
		return subscribeToLogs(callback, null, null);
	}

	/** Subscribes to every log level; a non-null user or device id limits delivery to that scope. */
	public Unsubscriber subscribeToLogs(Consumer<TelemetryRecord> callback, String userId, String deviceId) {
		if (callback == null) throw new ValidationException("Log subscriber callback must not be null");
		SubscribeOptions opts = new SubscribeOptions(TelemetryRecord.class::isInstance, false, userId, deviceId);
		List<Long> ids = new ArrayList<>(EventTypes.LOG_EVENTS.length);
		for (String event : EventTypes.LOG_EVENTS) {
			ids.add(bus.subscribe(event, payload -> callback.accept((TelemetryRecord) payload), opts));
		}
		return unsubscriberFor(ids);
	}

	public Unsubscriber subscribeToMetrics(Consumer<MetricRecord> callback) {
		if (callback == null) throw new ValidationException("Metric subscriber callback must not be null");
		long id = bus.subscribe(
			EventTypes.LOG_METRIC,
			payload -> callback.accept((MetricRecord) payload),
			SubscribeOptions.filtered(MetricRecord.class::isInstance));
		return unsubscriberFor(List.of(id));
	}

	/** Buffered logs and metrics, newest first; {@code limit <= 0} returns the whole buffer. */
	public List<TelemetryEntry> getLatestLogs(int limit) {
		List<TelemetryEntry> all = buffer.getAll();
		// equal timestamps keep the most recently inserted entry first
		Collections.reverse(all);
		all.sort(Comparator.comparing(TelemetryEntry::timestamp, Comparator.reverseOrder()));
		return (limit > 0 && all.size() > limit) ? new ArrayList<>(all.subList(0, limit)) : all;
	}

	public List<TelemetryRecord> queryLogs(LogQuery query) {
		return (query == null ? LogQuery.all() : query).apply(buffer.getAll());
	}

	public void clearLogs() {
		buffer.clear();
		log.debug("Telemetry buffer cleared");
	}

	public GatingStatistics gatingStatistics() {
		return statistics;
	}

	// === Ingestion ===

	private void ingestLog(LogLevel level, String message, Map<String, ?> context, String category, Origin origin) {
		try {
			if (!passesGates(level, category, message, context)) return;
			final Origin o = origin == null ? Origin.NONE : origin;
			final String traceId = o.traceId() != null ? o.traceId() : traces.currentTraceId();
			TelemetryRecord r = new TelemetryRecord(
				TelemetryIds.newId(clock),
				clock.instant(),
				level,
				category,
				message,
				ContextSanitizer.sanitize(context),
				traceId,
				o.userId(),
				o.deviceId(),
				null,
				TelemetryRecord.PIPELINE_SOURCE);
			deliver(r, true);
		} catch (RuntimeException ex) {
			fallback.internalFailure("Telemetry ingestion failed for " + level + " '" + message + "'", ex);
		}
	}

	/** Records offered on the bus by other components (e.g. the error factory). */
	void ingestPublished(TelemetryRecord r) {
		try {
			if (!passesGates(r.level(), r.category(), r.message(), r.context())) return;
			deliver(withTrace(r), true);
		} catch (RuntimeException ex) {
			fallback.internalFailure("Telemetry ingestion of published record id=" + r.id() + " failed", ex);
		}
	}

	void onHandlerFailure(HandlerFailure failure) {
		try {
			if (emergencyDrop()) return;
			final String category = ErrorCategory.SYSTEM.value();
			if (!throttleAccepts(category)) return;

			Map<String, Object> ctx = new LinkedHashMap<>();
			ctx.put("event", failure.eventName());
			ctx.put("listenerId", failure.subscriptionId());
			ctx.put("handlerError", failure.errorMessage());
			if (failure.userId() != null) ctx.put("userId", failure.userId());
			if (failure.deviceId() != null) ctx.put("deviceId", failure.deviceId());

			TelemetryRecord r = new TelemetryRecord(
				TelemetryIds.newId(clock),
				clock.instant(),
				LogLevel.ERROR,
				category,
				"Event handler failed for event '" + failure.eventName() + "': " + failure.errorMessage(),
				ctx,
				traces.currentTraceId(),
				failure.userId(),
				failure.deviceId(),
				null,
				TelemetryRecord.PIPELINE_SOURCE);
			deliver(r, !broadcasting.get());
		} catch (RuntimeException ex) {
			fallback.internalFailure("Could not record handler failure for event '" + failure.eventName() + "'", ex);
		}
	}

	void onGuardianTransition(GuardianTransition t) {
		Map<String, Object> ctx = new LinkedHashMap<>();
		ctx.put("heapUsage", t.ratio());
		ctx.put("threshold", t.threshold());
		ctx.put("emergencyActive", t.active());
		TelemetryRecord notice = new TelemetryRecord(
			TelemetryIds.newId(clock),
			clock.instant(),
			t.active() ? LogLevel.ERROR : LogLevel.INFO,
			ErrorCategory.SYSTEM.value(),
			t.message(),
			ctx,
			null,
			null,
			null,
			null,
			TelemetryRecord.PIPELINE_SOURCE);
		// bypasses every gate: the notice announcing the emergency must get through
		accept(notice, true);
		broadcast(EventTypes.SYSTEM_EMERGENCY, t, null, null);
	}

	void onMemoryWarning(MemoryWarning w) {
		broadcast(EventTypes.SYSTEM_MEMORY_WARNING, w, null, null);
		Map<String, Object> ctx = new LinkedHashMap<>();
		ctx.put("heapUsage", w.ratio());
		ctx.put("threshold", w.threshold());
		ctx.put("gcRequested", w.gcRequested());
		ingestLog(LogLevel.WARN, w.message(), ctx, ErrorCategory.SYSTEM.value(), Origin.NONE);
	}

	void sweep() {
		try {
			for (ThrottleDecision.Summary s : throttle.sweep()) {
				reportSuppression(s);
			}
			dedup.sweep();
		} catch (RuntimeException ex) {
			log.error("Telemetry sweep failed", ex);
		}
	}

	// === Gates ===

	private boolean passesGates(LogLevel level, String category, String message, Map<String, ?> context) {
		if (emergencyDrop()) return false;
		if (level == LogLevel.ERROR && !throttleAccepts(category)) return false;
		if (noise.dropLog(level, category, message, context)) {
			statistics.recordDrop(DropReason.FILTERED);
			return false;
		}
		return true;
	}

	private boolean emergencyDrop() {
		if (!guardian.isEmergencyActive()) return false;
		statistics.recordDrop(DropReason.EMERGENCY);
		return true;
	}

	private boolean throttleAccepts(String category) {
		ThrottleDecision d = throttle.shouldAccept(category);
		if (d.hasSummary()) reportSuppression(d.summary());
		if (!d.accepted()) {
			statistics.recordDrop(DropReason.THROTTLED);
			return false;
		}
		return true;
	}

	private void reportSuppression(ThrottleDecision.Summary s) {
		if (guardian.isEmergencyActive()) return;
		Map<String, Object> ctx = new LinkedHashMap<>();
		ctx.put("suppressedCount", s.suppressed());
		ctx.put("windowMs", s.window().toMillis());
		TelemetryRecord r = new TelemetryRecord(
			TelemetryIds.newId(clock),
			clock.instant(),
			LogLevel.WARN,
			s.category(),
			s.message(),
			ctx,
			null,
			null,
			null,
			null,
			TelemetryRecord.PIPELINE_SOURCE);
		accept(r, !broadcasting.get());
	}

	// === Delivery ===

	private void deliver(TelemetryRecord r, boolean broadcast) {
		if (dedup.isDuplicate(r)) {
			statistics.recordDrop(DropReason.DUPLICATE);
			return;
		}
		accept(r, broadcast);
	}

	private void accept(TelemetryRecord r, boolean broadcast) {
		statistics.recordAccepted();
		buffer.add(r);
		writeTransport(r);
		if (r.level() == LogLevel.ERROR) traces.recordError(r);
		persist(r);
		if (broadcast) broadcast(r.level().eventName(), r, r.userId(), r.deviceId());
	}

	private void writeTransport(TelemetryEntry entry) {
		try {
			if (entry instanceof TelemetryRecord r) transport.write(r);
			else if (entry instanceof MetricRecord m) transport.writeMetric(m);
		} catch (RuntimeException ex) {
			fallback.internalFailure("Telemetry transport failed for record id=" + entry.id(), ex);
		}
	}

	private void persist(TelemetryRecord r) {
		if (userLogs == null || r.userId() == null) return;
		try {
			persistenceExecutor.execute(() -> {
				try {
					userLogs.persistUserLog(
						r.userId(), r.level(), r.message(), r.category(), r.context(), r.traceId(), r.deviceId());
				} catch (PersistenceException | RuntimeException ex) {
					fallback.internalFailure("Failed to persist user log id=" + r.id() + " for user " + r.userId(), ex);
				}
			});
		} catch (RejectedExecutionException ex) {
			fallback.internalFailure("User log persistence rejected for record id=" + r.id(), ex);
		}
	}

	private void broadcast(String event, Object payload, String userId, String deviceId) {
		final boolean outermost = !broadcasting.get();
		broadcasting.set(Boolean.TRUE);
		try {
			bus.emit(event, payload, new EmitOptions(userId, deviceId));
		} catch (RuntimeException ex) {
			log.error("Broadcast of '{}' failed", event, ex);
		} finally {
			if (outermost) broadcasting.remove();
		}
	}

	private TelemetryRecord withTrace(TelemetryRecord r) {
		if (r.traceId() != null) return r;
		String traceId = traces.currentTraceId();
		return traceId == null ? r : r.withTraceId(traceId);
	}

	private Unsubscriber unsubscriberFor(List<Long> ids) {
		final AtomicBoolean done = new AtomicBoolean(false);
		return () -> {
			if (done.compareAndSet(false, true)) ids.forEach(bus::unsubscribe);
		};
	}

	private static ThreadFactory daemon(String name) {
		return r -> {
			Thread t = new Thread(r, name);
			t.setDaemon(true);
			return t;
		};
	}

	/** Collaborators not set fall back to their defaults. */
	public static final class Builder {
		private final EventBus bus;
		private ThrottleGuard throttle;
		private DedupFilter dedup;
		private NoiseFilter noise;
		private MemoryGuardian guardian;
		private int bufferCapacity = CircularLogStore.DEFAULT_CAPACITY;
		private LogTransport transport;
		private UserLogRepository userLogs;
		private Executor persistenceExecutor;
		private TraceCorrelation traces;
		private FallbackTelemetrySink fallback;
		private Clock clock;
		private Duration sweepInterval;

		private Builder(EventBus bus) {
			this.bus = bus;
		}

		public Builder throttle(ThrottleGuard throttle) {
			this.throttle = throttle;
			return this;
		}

		public Builder dedup(DedupFilter dedup) {
			this.dedup = dedup;
			return this;
		}

		public Builder noise(NoiseFilter noise) {
			this.noise = noise;
			return this;
		}

		public Builder guardian(MemoryGuardian guardian) {
			this.guardian = guardian;
			return this;
		}

		public Builder bufferCapacity(int bufferCapacity) {
			this.bufferCapacity = bufferCapacity;
			return this;
		}

		public Builder transport(LogTransport transport) {
			this.transport = transport;
			return this;
		}

		public Builder userLogs(UserLogRepository userLogs) {
			this.userLogs = userLogs;
			return this;
		}

		public Builder persistenceExecutor(Executor persistenceExecutor) {
			this.persistenceExecutor = persistenceExecutor;
			return this;
		}

		public Builder traces(TraceCorrelation traces) {
			this.traces = traces;
			return this;
		}

		public Builder fallback(FallbackTelemetrySink fallback) {
			this.fallback = fallback;
			return this;
		}

		public Builder clock(Clock clock) {
			this.clock = clock;
			return this;
		}

		public Builder sweepInterval(Duration sweepInterval) {
			this.sweepInterval = sweepInterval;
			return this;
		}

		public TelemetryPipeline build() {
			return new TelemetryPipeline(this);
		}
	}
}
