package com.mcpdesktop.telemetry.gating;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-category fixed-window rate limiter for error records.
 *
 * <p>Within one window at most {@code threshold} calls per category are accepted; the rest are counted as suppressed.
 * The first call after the window expired resets the state and is accepted; if the previous window suppressed
 * anything, the decision carries a one-off summary of it. Each category's state is updated atomically, so concurrent
 * callers never undercount.
 */
public class ThrottleGuard {

	private static final Logger log = LoggerFactory.getLogger(ThrottleGuard.class);

	public static final Duration DEFAULT_WINDOW = Duration.ofSeconds(1);
	public static final int DEFAULT_THRESHOLD = 10;

	static final String UNKNOWN_CATEGORY = "unknown";

	private final Duration window;
	private final long windowMillis;
	private final int threshold;
	private final Clock clock;
	private final ConcurrentMap<String, State> states = new ConcurrentHashMap<>();

	public ThrottleGuard() {
		this(DEFAULT_WINDOW, DEFAULT_THRESHOLD, Clock.systemUTC());
	}

	public ThrottleGuard(Duration window, int threshold, Clock clock) {
		if (window == null || window.isNegative() || window.isZero()) {
			throw new IllegalArgumentException("throttle window must be positive");
		}
		if (threshold <= 0) {
			throw new IllegalArgumentException("throttle threshold must be > 0 (was " + threshold + ")");
		}
		this.window = window;
		this.windowMillis = window.toMillis();
		this.threshold = threshold;
		this.clock = clock;
	}

	public ThrottleDecision shouldAccept(String category) {
		final String key = (category == null || category.isBlank()) ? UNKNOWN_CATEGORY : category;
		final long now = clock.millis();
		final ThrottleDecision[] decision = new ThrottleDecision[1];

		states.compute(key, (k, st) -> {
			if (st == null) {
				decision[0] = ThrottleDecision.ACCEPT;
				return new State(now);
			}
			if (now - st.windowStart > windowMillis) {
				ThrottleDecision.Summary summary =
					st.suppressed > 0 ? new ThrottleDecision.Summary(k, st.suppressed, window) : null;
				st.reset(now);
				decision[0] = summary == null ? ThrottleDecision.ACCEPT : new ThrottleDecision(true, summary);
				return st;
			}
			if (st.count >= threshold) {
				st.suppressed++;
				decision[0] = ThrottleDecision.SUPPRESS;
				return st;
			}
			st.count++;
			decision[0] = ThrottleDecision.ACCEPT;
			return st;
		});

		if (decision[0].hasSummary()) {
			log.debug("Throttle window closed: {}", decision[0].summary().message());
		}
		return decision[0];
	}

	/**
	 * Drops states whose window has expired. Windows that ended with suppressions and saw no later call are returned
	 * so their summary still gets reported.
	 */
	public List<ThrottleDecision.Summary> sweep() {
		final long now = clock.millis();
		final List<ThrottleDecision.Summary> pending = new ArrayList<>();
		for (String key : states.keySet()) {
			states.computeIfPresent(key, (k, st) -> {
				if (now - st.windowStart <= windowMillis) return st;
				if (st.suppressed > 0) pending.add(new ThrottleDecision.Summary(k, st.suppressed, window));
				return null;
			});
		}
		if (!pending.isEmpty()) {
			log.debug("Throttle sweep closed {} window(s) with suppressions", pending.size());
		}
		return pending;
	}

	/** Number of categories currently tracked. */
	public int trackedCategories() {
		return states.size();
	}

	public Duration window() {
		return window;
	}

	public int threshold() {
		return threshold;
	}

	private static final class State {
		long windowStart;
		int count;
		int suppressed;

		State(long now) {
			reset(now);
		}

		void reset(long now) {
			windowStart = now;
			count = 1;
			suppressed = 0;
		}
	}
}
