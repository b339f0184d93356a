package com.mcpdesktop.telemetry.store;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.mcpdesktop.telemetry.model.TelemetryEntry;

/**
 * Fixed-capacity ring buffer of the most recent telemetry. Inserts are O(1); when full the oldest entry is
 * overwritten. {@link #getAll()} always returns chronological order, even after the cursor wrapped.
 */
public class CircularLogStore<T extends TelemetryEntry> {

	public static final int DEFAULT_CAPACITY = 100;

	private final Object[] slots;
	private int cursor; // next write position
	private int size;

	public CircularLogStore() {
		this(DEFAULT_CAPACITY);
	}

	public CircularLogStore(int capacity) {
		if (capacity <= 0) {
			throw new IllegalArgumentException("capacity must be > 0 (was " + capacity + ")");
		}
		this.slots = new Object[capacity];
	}

	public synchronized void add(T entry) {
		if (entry == null) return;
		slots[cursor] = entry;
		cursor = (cursor + 1) % slots.length;
		if (size < slots.length) size++;
	}

	/** Oldest first. */
	@SuppressWarnings("unchecked")
	public synchronized List<T> getAll() {
		List<T> out = new ArrayList<>(size);
		int start = (size < slots.length) ? 0 : cursor;
		for (int i = 0; i < size; i++) {
			out.add((T) slots[(start + i) % slots.length]);
		}
		return out;
	}

	public synchronized void clear() {
		Arrays.fill(slots, null);
		cursor = 0;
		size = 0;
	}

	public synchronized int size() {
		return size;
	}

	public int capacity() {
		return slots.length;
	}
}
