package com.mcpdesktop.telemetry.gating;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.LongAdder;

/** Running counts of accepted and dropped telemetry, by drop reason. */
public final class GatingStatistics {

	private final LongAdder accepted = new LongAdder();
	private final Map<DropReason, LongAdder> dropped = new EnumMap<>(DropReason.class);

	public GatingStatistics() {
		for (DropReason r : DropReason.values()) {
			dropped.put(r, new LongAdder());
		}
	}

	public void recordAccepted() {
		accepted.increment();
	}

	public void recordDrop(DropReason reason) {
		dropped.get(reason).increment();
	}

	public long accepted() {
		return accepted.sum();
	}

	public long dropped(DropReason reason) {
		return dropped.get(reason).sum();
	}

	public long droppedTotal() {
		long total = 0;
		for (LongAdder a : dropped.values()) total += a.sum();
		return total;
	}

	public Map<DropReason, Long> droppedByReason() {
		Map<DropReason, Long> out = new EnumMap<>(DropReason.class);
		dropped.forEach((r, a) -> out.put(r, a.sum()));
		return Collections.unmodifiableMap(out);
	}

	@Override
	public String toString() {
		return "GatingStatistics{accepted=" + accepted() + ", dropped=" + droppedByReason() + "}";
	}
}
