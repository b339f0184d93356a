package com.mcpdesktop.telemetry.receivers;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import com.mcpdesktop.telemetry.model.LogLevel;

/**
 * Bounded per-user log store used when the host does not provide its own {@link UserLogRepository}. Keeps the newest
 * {@code maxPerUser} entries of each user.
 */
public class InMemoryUserLogRepository implements UserLogRepository {

	public static final int DEFAULT_MAX_PER_USER = 1000;

	private final int maxPerUser;
	private final Clock clock;
	private final AtomicLong ids = new AtomicLong();
	private final Map<String, Deque<UserLogEntry>> byUser = new ConcurrentHashMap<>();

	public InMemoryUserLogRepository() {
		this(DEFAULT_MAX_PER_USER, Clock.systemUTC());
	}

	public InMemoryUserLogRepository(int maxPerUser, Clock clock) {
		if (maxPerUser <= 0) throw new IllegalArgumentException("maxPerUser must be > 0");
		this.maxPerUser = maxPerUser;
		this.clock = clock;
	}

	@Override
	public void persistUserLog(
		String userId,
		LogLevel level,
		String message,
		String category,
		Map<String, Object> context,
		String traceId,
		String deviceId)
		throws PersistenceException {

		if (userId == null || userId.isBlank()) {
			throw new PersistenceException("userId is required to persist a user log");
		}
		UserLogEntry entry = new UserLogEntry(
			ids.incrementAndGet(), userId, level, message, category, context, traceId, deviceId, clock.instant());
		Deque<UserLogEntry> logs = byUser.computeIfAbsent(userId, k -> new ArrayDeque<>());
		synchronized (logs) {
			logs.addLast(entry);
			while (logs.size() > maxPerUser) logs.removeFirst();
		}
	}

	/** Newest first; {@code limit <= 0} returns everything. */
	public List<UserLogEntry> findByUser(String userId, int limit) {
		Deque<UserLogEntry> logs = byUser.get(userId);
		if (logs == null) return List.of();
		List<UserLogEntry> out = new ArrayList<>();
		synchronized (logs) {
			for (Iterator<UserLogEntry> it = logs.descendingIterator(); it.hasNext(); ) {
				if (limit > 0 && out.size() >= limit) break;
				out.add(it.next());
			}
		}
		return out;
	}

	public void clearUser(String userId) {
		byUser.remove(userId);
	}
}
