package com.mcpdesktop.telemetry.memory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodic heap sampler that switches the pipeline into emergency mode when the heap is nearly exhausted.
 *
 * <p>Emergency mode is hysteretic: it is entered when utilization rises above {@code emergencyThreshold} and left only
 * once it falls below the strictly lower {@code recoveryThreshold}. Each transition is reported exactly once.
 *
 * <p>A second, slower sampler raises advisory {@link MemoryWarning}s above {@code warningThreshold} and can hint the
 * JVM to collect garbage. Warnings never gate telemetry.
 */
public class MemoryGuardian implements AutoCloseable {

	private static final Logger log = LoggerFactory.getLogger(MemoryGuardian.class);

	private final Settings settings;
	private final HeapUsageProbe probe;
	private final Clock clock;
	private final Runnable gcHint;
	private final AtomicBoolean emergency = new AtomicBoolean(false);

	private volatile double lastRatio = Double.NaN;
	private volatile Instant lastSample;
	private volatile Consumer<GuardianTransition> transitionListener;
	private volatile Consumer<MemoryWarning> warningListener;

	private ScheduledExecutorService scheduler;

	public MemoryGuardian() {
		this(Settings.defaults(), HeapUsageProbe.jvm(), Clock.systemUTC(), System::gc);
	}

	public MemoryGuardian(Settings settings, HeapUsageProbe probe, Clock clock, Runnable gcHint) {
		this.settings = settings;
		this.probe = probe;
		this.clock = clock;
		this.gcHint = gcHint;
	}

	public boolean isEmergencyActive() {
		return emergency.get();
	}

	public double lastRatio() {
		return lastRatio;
	}

	public Instant lastSample() {
		return lastSample;
	}

	public void setTransitionListener(Consumer<GuardianTransition> listener) {
		this.transitionListener = listener;
	}

	public void setWarningListener(Consumer<MemoryWarning> listener) {
		this.warningListener = listener;
	}

	// === Sampling ===

	/** Reads the probe once and applies the result. Probe failures leave the state unchanged. */
	public GuardianTransition sampleNow() {
		final double ratio;
		try {
			ratio = probe.heapUsageRatio();
		} catch (RuntimeException ex) {
			log.warn("Heap usage probe failed; emergency state unchanged (active={})", emergency.get(), ex);
			return null;
		}
		return evaluate(ratio);
	}

	/** Applies one utilization sample; returns the transition it caused, or null. */
	public GuardianTransition evaluate(double ratio) {
		lastRatio = ratio;
		lastSample = clock.instant();

		GuardianTransition transition = null;
		if (ratio > settings.emergencyThreshold() && emergency.compareAndSet(false, true)) {
			transition = new GuardianTransition(true, ratio, settings.emergencyThreshold(), lastSample);
			log.error(transition.message());
		} else if (ratio < settings.recoveryThreshold() && emergency.compareAndSet(true, false)) {
			transition = new GuardianTransition(false, ratio, settings.recoveryThreshold(), lastSample);
			log.info(transition.message());
		}
		if (transition != null) notifyTransition(transition);
		return transition;
	}

	/** Advisory check; returns the warning raised, or null when utilization is below the warning threshold. */
	public MemoryWarning checkWarning() {
		final double ratio;
		try {
			ratio = probe.heapUsageRatio();
		} catch (RuntimeException ex) {
			log.warn("Heap usage probe failed during warning check", ex);
			return null;
		}
		if (ratio <= settings.warningThreshold()) return null;

		boolean gc = settings.requestGcOnWarning();
		MemoryWarning warning = new MemoryWarning(ratio, settings.warningThreshold(), gc, clock.instant());
		log.warn(warning.message());
		if (gc) {
			try {
				gcHint.run();
			} catch (RuntimeException ex) {
				log.debug("GC hint failed", ex);
			}
		}
		Consumer<MemoryWarning> l = warningListener;
		if (l != null) {
			try {
				l.accept(warning);
			} catch (RuntimeException ex) {
				log.error("Memory warning listener failed", ex);
			}
		}
		return warning;
	}

	// === Lifecycle ===

	public synchronized void start() {
		if (scheduler != null) return;
		scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
			Thread t = new Thread(r, "telemetry-memory-guardian");
			t.setDaemon(true);
			return t;
		});
		long sampleMs = settings.sampleInterval().toMillis();
		long warnMs = settings.warningInterval().toMillis();
		scheduler.scheduleAtFixedRate(this::sampleNow, sampleMs, sampleMs, TimeUnit.MILLISECONDS);
		scheduler.scheduleAtFixedRate(this::checkWarning, warnMs, warnMs, TimeUnit.MILLISECONDS);
		log.debug("Memory guardian started (sample every {}ms, warning check every {}ms)", sampleMs, warnMs);
	}

	public synchronized boolean isRunning() {
		return scheduler != null;
	}

	@Override
	public synchronized void close() {
		if (scheduler == null) return;
		scheduler.shutdownNow();
		try {
			if (!scheduler.awaitTermination(1, TimeUnit.SECONDS)) {
				log.warn("Memory guardian sampler did not stop within 1s");
			}
		} catch (InterruptedException ex) {
			Thread.currentThread().interrupt();
		}
		scheduler = null;
		log.debug("Memory guardian stopped");
	}

	private void notifyTransition(GuardianTransition transition) {
		Consumer<GuardianTransition> l = transitionListener;
		if (l == null) return;
		try {
			l.accept(transition);
		} catch (RuntimeException ex) {
			log.error("Memory guardian transition listener failed", ex);
		}
	}

	/**
	 * Thresholds are heap utilization ratios. Requires {@code 0 < recovery < emergency <= 1}.
	 */
	public record Settings(
		double emergencyThreshold,
		double recoveryThreshold,
		Duration sampleInterval,
		double warningThreshold,
		Duration warningInterval,
		boolean requestGcOnWarning) {

		public Settings {
			if (!(recoveryThreshold > 0 && recoveryThreshold < emergencyThreshold && emergencyThreshold <= 1.0)) {
				throw new IllegalArgumentException(
					"memory thresholds must satisfy 0 < recovery < emergency <= 1 (recovery=" + recoveryThreshold
						+ ", emergency=" + emergencyThreshold + ")");
			}
			if (warningThreshold <= 0 || warningThreshold > 1.0) {
				throw new IllegalArgumentException("memory warning threshold must be within (0,1]");
			}
			requirePositive(sampleInterval, "sampleInterval");
			requirePositive(warningInterval, "warningInterval");
		}

		public static Settings defaults() {
			return new Settings(0.95, 0.80, Duration.ofSeconds(5), 0.85, Duration.ofSeconds(30), true);
		}

		private static void requirePositive(Duration d, String name) {
			if (d == null || d.isZero() || d.isNegative()) {
				throw new IllegalArgumentException("memory " + name + " must be positive");
			}
		}
	}
}
